package com.example.agenda.service.util;

import com.example.agenda.service.exception.AppointmentValidationException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Reads booking timestamps as wall-clock time of the business zone.
 */
public final class AgendaTimestamps {

    private AgendaTimestamps() {
    }

    /**
     * Accepts {@code YYYY-MM-DDTHH:MM[:SS]} (taken as business-zone time) or the same with
     * an offset such as {@code Z} or {@code +02:00} (converted into the business zone).
     * Fractions of a second are dropped.
     */
    public static LocalDateTime parse(String raw, String field, ZoneId zone) {
        if (raw == null || raw.isBlank()) {
            throw new AppointmentValidationException(field + " is required");
        }
        String text = raw.trim().replace(' ', 'T');
        try {
            return LocalDateTime.parse(text).truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException ignored) {
            // may still carry an offset
        }
        try {
            return OffsetDateTime.parse(text)
                    .atZoneSameInstant(zone)
                    .toLocalDateTime()
                    .truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException e) {
            throw new AppointmentValidationException(
                    field + " must be ISO 8601: YYYY-MM-DDTHH:MM[:SS], got '" + raw + "'");
        }
    }

    public static LocalDateTime startOfDay(LocalDate day) {
        return day.atStartOfDay();
    }

    /** Exclusive end of {@code day}. */
    public static LocalDateTime endOfDay(LocalDate day) {
        return day.plusDays(1).atStartOfDay();
    }
}
