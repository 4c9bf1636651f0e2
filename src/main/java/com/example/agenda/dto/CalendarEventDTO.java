package com.example.agenda.dto;

import com.example.agenda.model.Appointment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarEventDTO {
    private Long id;
    private String title;
    private LocalDateTime start;
    private LocalDateTime end;
    private Long providerId;
    private Long customerRef;
    private Long serviceRef;
    private Appointment.Status status;
    private Appointment.BookingChannel bookingChannel;
    private String notes;
}
