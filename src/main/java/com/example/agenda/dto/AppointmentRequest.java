package com.example.agenda.dto;

import com.example.agenda.model.Appointment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Body of create and update calls. On update, {@code null} leaves a field unchanged
 * and an empty {@code notes} clears the notes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentRequest {
    private Long customerRef;
    private Long serviceRef;
    private Long providerId;

    /** ISO 8601 local or offset timestamp. */
    private String start;

    private Integer durationMinutes;
    private Appointment.Status status;
    private Appointment.BookingChannel bookingChannel;
    private BigDecimal price;
    private String notes;
}
