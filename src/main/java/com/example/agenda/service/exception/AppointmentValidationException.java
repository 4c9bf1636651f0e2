package com.example.agenda.service.exception;

/**
 * Malformed or out-of-range booking input.
 */
public class AppointmentValidationException extends RuntimeException {

    public AppointmentValidationException(String message) {
        super(message);
    }
}
