package com.example.agenda.dto;

import com.example.agenda.model.Appointment;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConflictCheckDTO(boolean conflict, ConflictingAppointment with) {

    public static ConflictCheckDTO none() {
        return new ConflictCheckDTO(false, null);
    }

    public static ConflictCheckDTO of(Appointment a) {
        return new ConflictCheckDTO(true, new ConflictingAppointment(a.getId(), a.getStart(), a.getEnd()));
    }

    public record ConflictingAppointment(Long id, LocalDateTime start, LocalDateTime end) {
    }
}
