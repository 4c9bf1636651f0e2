package com.example.agenda.service.impl;

import com.example.agenda.config.AgendaProperties;
import com.example.agenda.dto.AppointmentRequest;
import com.example.agenda.dto.CalendarEventDTO;
import com.example.agenda.model.Appointment;
import com.example.agenda.repository.AppointmentRepository;
import com.example.agenda.service.AppointmentScope;
import com.example.agenda.service.AppointmentService;
import com.example.agenda.service.CustomerDirectory;
import com.example.agenda.service.ScheduleLockService;
import com.example.agenda.service.ServiceCatalog;
import com.example.agenda.service.StatusTransitionPolicy;
import com.example.agenda.service.exception.AppointmentConflictException;
import com.example.agenda.service.exception.AppointmentNotFoundException;
import com.example.agenda.service.exception.AppointmentValidationException;
import com.example.agenda.service.util.AgendaTimestamps;
import com.example.agenda.service.util.ConflictDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentServiceImpl implements AppointmentService {

    private final AppointmentRepository repository;
    private final ScheduleLockService locks;
    private final ServiceCatalog catalog;
    private final CustomerDirectory customers;
    private final StatusTransitionPolicy transitions;
    private final AgendaProperties properties;

    @Override
    @Transactional
    public Appointment create(AppointmentRequest req, AppointmentScope scope) {
        if (req.getCustomerRef() == null) {
            throw new AppointmentValidationException("customerRef is required");
        }
        Long providerId = req.getProviderId() != null ? req.getProviderId() : scope.providerId();
        requireProvider(providerId, scope);

        LocalDateTime start = AgendaTimestamps.parse(req.getStart(), "start", properties.zoneId());
        int duration = resolveDuration(req);

        locks.lock(List.of(new ScheduleLockService.Key(providerId, start.toLocalDate())));
        ensureFree(providerId, start, duration, null);

        Appointment a = new Appointment();
        a.setCustomerRef(req.getCustomerRef());
        a.setServiceRef(req.getServiceRef());
        a.setProviderId(providerId);
        a.setStart(start);
        a.setDurationMinutes(duration);
        if (req.getStatus() != null) {
            a.setStatus(req.getStatus());
        }
        if (req.getBookingChannel() != null) {
            a.setBookingChannel(req.getBookingChannel());
        }
        a.setPrice(req.getPrice());
        a.setNotes(blankToNull(req.getNotes()));

        Appointment saved = repository.save(a);
        log.info("Appointment #{} booked: provider={}, {} - {}, status={}",
                saved.getId(), providerId, saved.getStart(), saved.getEnd(), saved.getStatus());
        return saved;
    }

    @Override
    @Transactional
    public Appointment update(Long id, AppointmentRequest req, AppointmentScope scope) {
        Appointment current = loadForUpdate(id, scope);

        LocalDateTime newStart = req.getStart() != null
                ? AgendaTimestamps.parse(req.getStart(), "start", properties.zoneId())
                : current.getStart();
        int newDuration = req.getDurationMinutes() != null ? req.getDurationMinutes() : current.getDurationMinutes();
        if (newDuration <= 0) {
            throw new AppointmentValidationException("durationMinutes must be > 0");
        }
        Long newProvider = req.getProviderId() != null ? req.getProviderId() : current.getProviderId();
        requireProvider(newProvider, scope);

        Appointment.Status newStatus = req.getStatus() != null ? req.getStatus() : current.getStatus();
        requireTransition(current.getStatus(), newStatus);

        boolean moved = !newStart.equals(current.getStart())
                || newDuration != current.getDurationMinutes()
                || !newProvider.equals(current.getProviderId());
        boolean reactivated = !current.isActive() && newStatus.isActive();

        if (newStatus.isActive() && (moved || reactivated)) {
            locks.lock(List.of(
                    new ScheduleLockService.Key(current.getProviderId(), current.getStart().toLocalDate()),
                    new ScheduleLockService.Key(newProvider, newStart.toLocalDate())));
            ensureFree(newProvider, newStart, newDuration, current.getId());
        }

        if (req.getCustomerRef() != null) {
            current.setCustomerRef(req.getCustomerRef());
        }
        if (req.getServiceRef() != null) {
            current.setServiceRef(req.getServiceRef());
        }
        if (req.getPrice() != null) {
            current.setPrice(req.getPrice());
        }
        if (req.getNotes() != null) {
            current.setNotes(blankToNull(req.getNotes()));
        }
        if (req.getBookingChannel() != null) {
            current.setBookingChannel(req.getBookingChannel());
        }
        current.setStart(newStart);
        current.setDurationMinutes(newDuration);
        current.setProviderId(newProvider);
        current.setStatus(newStatus);

        Appointment saved = repository.save(current);
        log.info("Appointment #{} updated: provider={}, {} - {}, status={}",
                saved.getId(), saved.getProviderId(), saved.getStart(), saved.getEnd(), saved.getStatus());
        return saved;
    }

    @Override
    @Transactional
    public Appointment changeStatus(Long id, Appointment.Status status, AppointmentScope scope) {
        if (status == null) {
            throw new AppointmentValidationException("status is required");
        }
        Appointment current = loadForUpdate(id, scope);
        Appointment.Status previous = current.getStatus();
        requireTransition(previous, status);

        // coming back from cancelled/no-show takes the slot again
        if (!previous.isActive() && status.isActive()) {
            locks.lock(List.of(new ScheduleLockService.Key(current.getProviderId(), current.getStart().toLocalDate())));
            ensureFree(current.getProviderId(), current.getStart(), current.getDurationMinutes(), current.getId());
        }

        current.setStatus(status);
        Appointment saved = repository.save(current);
        log.info("Appointment #{} status {} -> {}", id, previous.code(), status.code());
        return saved;
    }

    @Override
    @Transactional
    public void delete(Long id, AppointmentScope scope) {
        Appointment current = load(id, scope);
        repository.delete(current);
        log.info("Appointment #{} deleted (provider={}, start={})", id, current.getProviderId(), current.getStart());
    }

    @Override
    @Transactional(readOnly = true)
    public Appointment get(Long id, AppointmentScope scope) {
        return load(id, scope);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Appointment> checkConflict(Long providerId, LocalDateTime start, Integer durationMinutes, Long excludeId,
                                               AppointmentScope scope) {
        requireProvider(providerId, scope);
        if (start == null) {
            throw new AppointmentValidationException("start is required");
        }
        int duration = durationMinutes != null ? durationMinutes : properties.getScheduling().getDefaultDurationMinutes();
        if (duration <= 0) {
            throw new AppointmentValidationException("durationMinutes must be > 0");
        }
        return ConflictDetector.findConflict(providerId, start, duration, sameDay(providerId, start.toLocalDate()), excludeId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Appointment> list(LocalDateTime from, LocalDateTime to, Long providerId, Appointment.Status status,
                                  AppointmentScope scope) {
        if (from == null || to == null) {
            throw new AppointmentValidationException("from and to are required");
        }
        if (to.isBefore(from)) {
            throw new AppointmentValidationException("to must not be before from");
        }
        if (providerId != null && !scope.permits(providerId)) {
            return List.of();
        }
        Long effectiveProvider = providerId != null ? providerId : scope.providerId();

        List<Appointment> found = effectiveProvider != null
                ? repository.findByProviderIdAndStartBetweenOrderByStartAsc(effectiveProvider, from, to)
                : repository.findByStartBetweenOrderByStartAsc(from, to);

        if (status == null) {
            return found;
        }
        return found.stream()
                .filter(a -> a.getStatus() == status)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<CalendarEventDTO> calendar(LocalDateTime from, LocalDateTime to, Long providerId, AppointmentScope scope) {
        List<Appointment> appointments = list(from, to, providerId, null, scope);

        Set<Long> customerIds = appointments.stream()
                .map(Appointment::getCustomerRef)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Set<Long> serviceIds = appointments.stream()
                .map(Appointment::getServiceRef)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        Map<Long, String> customerNames = customers.displayNames(customerIds);
        Map<Long, String> serviceNames = catalog.names(serviceIds);

        return appointments.stream()
                .map(a -> CalendarEventDTO.builder()
                        .id(a.getId())
                        .title(title(a, customerNames, serviceNames))
                        .start(a.getStart())
                        .end(a.getEnd())
                        .providerId(a.getProviderId())
                        .customerRef(a.getCustomerRef())
                        .serviceRef(a.getServiceRef())
                        .status(a.getStatus())
                        .bookingChannel(a.getBookingChannel())
                        .notes(a.getNotes())
                        .build())
                .toList();
    }

    // ------------------ helpers ------------------

    private Appointment load(Long id, AppointmentScope scope) {
        return repository.findById(id)
                .filter(a -> scope.permits(a.getProviderId()))
                .orElseThrow(() -> new AppointmentNotFoundException(id));
    }

    // row stays locked until commit, so the values compared below cannot go stale
    private Appointment loadForUpdate(Long id, AppointmentScope scope) {
        return repository.findByIdForUpdate(id)
                .filter(a -> scope.permits(a.getProviderId()))
                .orElseThrow(() -> new AppointmentNotFoundException(id));
    }

    private int resolveDuration(AppointmentRequest req) {
        int duration;
        if (req.getDurationMinutes() != null) {
            duration = req.getDurationMinutes();
        } else {
            duration = catalog.defaultDurationMinutes(req.getServiceRef())
                    .orElse(properties.getScheduling().getDefaultDurationMinutes());
        }
        if (duration <= 0) {
            throw new AppointmentValidationException("durationMinutes must be > 0");
        }
        return duration;
    }

    private void requireProvider(Long providerId, AppointmentScope scope) {
        if (providerId == null || providerId <= 0) {
            throw new AppointmentValidationException("providerId must be > 0");
        }
        if (!scope.permits(providerId)) {
            throw new AppointmentValidationException("providerId " + providerId + " is outside the caller's scope");
        }
    }

    private void requireTransition(Appointment.Status from, Appointment.Status to) {
        if (!transitions.allows(from, to)) {
            throw new AppointmentValidationException(
                    "Status change " + from.code() + " -> " + to.code() + " is not allowed");
        }
    }

    private void ensureFree(Long providerId, LocalDateTime start, int duration, Long excludeId) {
        ConflictDetector.findConflict(providerId, start, duration, sameDay(providerId, start.toLocalDate()), excludeId)
                .ifPresent(conflict -> {
                    log.warn("Booking rejected: provider={}, {} +{}min overlaps appointment #{}",
                            providerId, start, duration, conflict.getId());
                    throw new AppointmentConflictException(conflict);
                });
    }

    private List<Appointment> sameDay(Long providerId, LocalDate day) {
        return repository.findSameDay(providerId, AgendaTimestamps.startOfDay(day), AgendaTimestamps.endOfDay(day));
    }

    private String title(Appointment a, Map<Long, String> customerNames, Map<Long, String> serviceNames) {
        String customer = customerNames.getOrDefault(a.getCustomerRef(), "Customer #" + a.getCustomerRef());
        String service = a.getServiceRef() == null ? null : serviceNames.get(a.getServiceRef());
        return service == null || service.isBlank() ? customer : customer + " · " + service;
    }

    private static String blankToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
