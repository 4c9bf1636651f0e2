package com.example.agenda.dto;

import com.example.agenda.model.Appointment;

public record StatusChangeRequest(Appointment.Status status) {
}
