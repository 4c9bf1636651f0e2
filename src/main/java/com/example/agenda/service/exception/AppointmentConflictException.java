package com.example.agenda.service.exception;

import com.example.agenda.model.Appointment;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * The requested window overlaps an active appointment of the same provider.
 */
@Getter
public class AppointmentConflictException extends RuntimeException {

    private final Long conflictingId;
    private final LocalDateTime conflictingStart;
    private final LocalDateTime conflictingEnd;

    public AppointmentConflictException(Appointment conflicting) {
        super("Conflict with appointment #" + conflicting.getId()
                + " from " + conflicting.getStart() + " to " + conflicting.getEnd());
        this.conflictingId = conflicting.getId();
        this.conflictingStart = conflicting.getStart();
        this.conflictingEnd = conflicting.getEnd();
    }
}
