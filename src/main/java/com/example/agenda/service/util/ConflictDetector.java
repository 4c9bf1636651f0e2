package com.example.agenda.service.util;

import com.example.agenda.model.Appointment;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a candidate booking overlaps an active appointment of the same
 * provider on the same calendar day. Does no I/O; the caller supplies the candidates.
 */
public final class ConflictDetector {

    private ConflictDetector() {
    }

    /**
     * @param excludeId appointment to ignore, usually the one being moved; may be {@code null}
     * @return the first overlapping appointment in iteration order of {@code existing}
     */
    public static Optional<Appointment> findConflict(Long providerId,
                                                     LocalDateTime candidateStart,
                                                     int durationMinutes,
                                                     Collection<Appointment> existing,
                                                     Long excludeId) {
        if (existing == null || existing.isEmpty()) {
            return Optional.empty();
        }
        TimeInterval candidate = TimeInterval.ofMinutes(candidateStart, durationMinutes);
        LocalDate day = candidateStart.toLocalDate();

        return existing.stream()
                .filter(a -> Objects.equals(a.getProviderId(), providerId))
                .filter(a -> a.getStart().toLocalDate().equals(day))
                .filter(Appointment::isActive)
                .filter(a -> excludeId == null || !excludeId.equals(a.getId()))
                .filter(a -> candidate.overlaps(new TimeInterval(a.getStart(), a.getEnd())))
                .findFirst();
    }
}
