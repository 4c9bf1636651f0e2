package com.example.agenda.service;

/**
 * Pre-authorized view on appointments. A restricted scope only sees the appointments of
 * one provider; records of other providers behave as if they did not exist.
 */
public record AppointmentScope(Long providerId) {

    public static final AppointmentScope UNRESTRICTED = new AppointmentScope(null);

    public static AppointmentScope ofProvider(Long providerId) {
        return providerId == null ? UNRESTRICTED : new AppointmentScope(providerId);
    }

    public boolean permits(Long appointmentProviderId) {
        return providerId == null || providerId.equals(appointmentProviderId);
    }
}
