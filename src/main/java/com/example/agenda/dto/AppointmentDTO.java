package com.example.agenda.dto;

import com.example.agenda.model.Appointment;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentDTO {
    private Long id;
    private Long customerRef;
    private Long serviceRef;
    private Long providerId;

    private LocalDateTime start;
    private LocalDateTime end;
    private int durationMinutes;

    private Appointment.Status status;
    private Appointment.BookingChannel bookingChannel;
    private BigDecimal price;
    private String notes;

    public static AppointmentDTO from(Appointment a) {
        return new AppointmentDTO(
                a.getId(),
                a.getCustomerRef(),
                a.getServiceRef(),
                a.getProviderId(),
                a.getStart(),
                a.getEnd(),
                a.getDurationMinutes(),
                a.getStatus(),
                a.getBookingChannel(),
                a.getPrice(),
                a.getNotes()
        );
    }
}
