package com.example.agenda.controllers;

import com.example.agenda.model.Appointment;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/** Lets request parameters use the lowercase status codes. */
@Component
public class AppointmentStatusConverter implements Converter<String, Appointment.Status> {

    @Override
    public Appointment.Status convert(String source) {
        return Appointment.Status.fromCode(source.trim());
    }
}
