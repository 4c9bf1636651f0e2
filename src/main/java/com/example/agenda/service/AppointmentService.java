package com.example.agenda.service;

import com.example.agenda.dto.AppointmentRequest;
import com.example.agenda.dto.CalendarEventDTO;
import com.example.agenda.model.Appointment;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Booking lifecycle of provider appointments. Every operation that moves an appointment
 * in time or onto another provider is checked against the provider's active bookings of
 * that day, atomically with its commit.
 */
public interface AppointmentService {

    Appointment create(AppointmentRequest request, AppointmentScope scope);

    Appointment update(Long id, AppointmentRequest request, AppointmentScope scope);

    Appointment changeStatus(Long id, Appointment.Status status, AppointmentScope scope);

    void delete(Long id, AppointmentScope scope);

    Appointment get(Long id, AppointmentScope scope);

    /** Active appointment overlapping the candidate window, if any. */
    Optional<Appointment> checkConflict(Long providerId, LocalDateTime start, Integer durationMinutes, Long excludeId,
                                        AppointmentScope scope);

    List<Appointment> list(LocalDateTime from, LocalDateTime to, Long providerId, Appointment.Status status,
                           AppointmentScope scope);

    List<CalendarEventDTO> calendar(LocalDateTime from, LocalDateTime to, Long providerId, AppointmentScope scope);
}
