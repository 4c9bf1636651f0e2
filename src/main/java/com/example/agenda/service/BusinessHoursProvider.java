package com.example.agenda.service;

import com.example.agenda.config.AgendaProperties;
import com.example.agenda.service.exception.AppointmentValidationException;
import com.example.agenda.service.util.TimeInterval;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Opening hours per provider. Loaded from {@code agenda.business-hours} on startup,
 * reloadable from configuration and replaceable per provider at runtime.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BusinessHoursProvider {

    private final AgendaProperties properties;

    private final AtomicReference<Templates> current = new AtomicReference<>(new Templates(List.of(), Map.of()));

    @PostConstruct
    public void reload() {
        AgendaProperties.BusinessHours config = properties.getBusinessHours();

        List<Window> defaults = parseAll(config.getDefaultWindows(), "default");
        Map<Long, List<Window>> loaded = new HashMap<>();
        config.getProviders().forEach((providerId, raw) ->
                loaded.put(providerId, parseAll(raw, "provider " + providerId)));

        current.set(new Templates(defaults, loaded));
        log.info("Business hours loaded: default={}, providers={}", defaults, loaded.keySet());
    }

    public List<Window> template(Long providerId) {
        Templates t = current.get();
        return t.providers().getOrDefault(providerId, t.defaults());
    }

    public boolean hasOwnTemplate(Long providerId) {
        return current.get().providers().containsKey(providerId);
    }

    /** The provider's windows placed on {@code date}, in opening order. */
    public List<TimeInterval> windowsOn(Long providerId, LocalDate date) {
        return template(providerId).stream()
                .map(w -> new TimeInterval(date.atTime(w.open()), date.atTime(w.close())))
                .toList();
    }

    public List<Window> replace(Long providerId, List<Window> windows) {
        if (windows == null || windows.isEmpty()) {
            throw new AppointmentValidationException("At least one opening window is required");
        }
        List<Window> sorted = windows.stream()
                .sorted(Comparator.comparing(Window::open))
                .toList();
        current.updateAndGet(t -> t.with(providerId, sorted));
        log.info("Business hours for provider {} replaced: {}", providerId, sorted);
        return sorted;
    }

    /** Drops the provider's own template so the default applies again. */
    public void reset(Long providerId) {
        Templates before = current.getAndUpdate(t -> t.without(providerId));
        if (before.providers().containsKey(providerId)) {
            log.info("Business hours for provider {} reset to default", providerId);
        }
    }

    private List<Window> parseAll(List<String> raw, String owner) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalStateException("No business hours configured for " + owner);
        }
        try {
            return raw.stream()
                    .map(Window::parse)
                    .sorted(Comparator.comparing(Window::open))
                    .toList();
        } catch (AppointmentValidationException e) {
            throw new IllegalStateException("Invalid business hours for " + owner + ": " + e.getMessage(), e);
        }
    }

    /** Immutable view of every template, swapped as a whole. */
    private record Templates(List<Window> defaults, Map<Long, List<Window>> providers) {

        Templates {
            providers = Map.copyOf(providers);
        }

        Templates with(Long providerId, List<Window> windows) {
            Map<Long, List<Window>> next = new HashMap<>(providers);
            next.put(providerId, windows);
            return new Templates(defaults, next);
        }

        Templates without(Long providerId) {
            Map<Long, List<Window>> next = new HashMap<>(providers);
            next.remove(providerId);
            return new Templates(defaults, next);
        }
    }

    /**
     * Wall-clock opening window {@code [open, close)}.
     */
    public record Window(LocalTime open, LocalTime close) {

        public Window {
            if (open == null || close == null) {
                throw new AppointmentValidationException("Opening window needs both open and close time");
            }
            if (!open.isBefore(close)) {
                throw new AppointmentValidationException("Opening window " + open + "-" + close + " closes before it opens");
            }
        }

        /** Parses {@code HH:mm-HH:mm}. */
        public static Window parse(String raw) {
            String[] parts = raw == null ? new String[0] : raw.trim().split("\\s*-\\s*");
            if (parts.length != 2) {
                throw new AppointmentValidationException("Opening window must look like HH:mm-HH:mm, got '" + raw + "'");
            }
            try {
                return new Window(LocalTime.parse(parts[0]), LocalTime.parse(parts[1]));
            } catch (DateTimeParseException e) {
                throw new AppointmentValidationException("Opening window must look like HH:mm-HH:mm, got '" + raw + "'");
            }
        }

        @Override
        public String toString() {
            return open + "-" + close;
        }
    }
}
