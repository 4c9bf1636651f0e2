package com.example.agenda.service;

import com.example.agenda.config.AgendaProperties;
import com.example.agenda.dto.AvailabilityDTO;
import com.example.agenda.dto.SlotDTO;
import com.example.agenda.model.Appointment;
import com.example.agenda.repository.AppointmentRepository;
import com.example.agenda.service.exception.AppointmentValidationException;
import com.example.agenda.service.util.AgendaTimestamps;
import com.example.agenda.service.util.SlotGenerator;
import com.example.agenda.service.util.TimeInterval;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Open booking starts of a provider on a day: business hours minus active appointments
 * (each extended by the buffer), walked with a sliding window. The result is a snapshot,
 * not a reservation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private static final EnumSet<Appointment.Status> INERT = EnumSet.of(Appointment.Status.CANCELLED, Appointment.Status.NO_SHOW);

    private final AppointmentRepository repository;
    private final BusinessHoursProvider businessHours;
    private final AgendaProperties properties;

    /** Same as the unscoped variant, for a caller that may only look at its own provider. */
    @Transactional(readOnly = true)
    public AvailabilityDTO listAvailability(Long providerId, LocalDate date,
                                            Integer durationMinutes, Integer stepMinutes, Integer bufferMinutes,
                                            AppointmentScope scope) {
        if (providerId != null && !scope.permits(providerId)) {
            throw new AppointmentValidationException("providerId " + providerId + " is outside the caller's scope");
        }
        return listAvailability(providerId, date, durationMinutes, stepMinutes, bufferMinutes);
    }

    @Transactional(readOnly = true)
    public AvailabilityDTO listAvailability(Long providerId, LocalDate date,
                                            Integer durationMinutes, Integer stepMinutes, Integer bufferMinutes) {
        AgendaProperties.Scheduling defaults = properties.getScheduling();
        int duration = durationMinutes != null ? durationMinutes : defaults.getDefaultDurationMinutes();
        int step = stepMinutes != null ? stepMinutes : defaults.getDefaultStepMinutes();
        int buffer = bufferMinutes != null ? bufferMinutes : defaults.getDefaultBufferMinutes();

        if (providerId == null || providerId <= 0) {
            throw new AppointmentValidationException("providerId must be > 0");
        }
        if (date == null) {
            throw new AppointmentValidationException("date is required");
        }
        if (duration <= 0) {
            throw new AppointmentValidationException("durationMinutes must be > 0");
        }
        if (step <= 0) {
            throw new AppointmentValidationException("step must be > 0");
        }
        if (buffer < 0) {
            throw new AppointmentValidationException("bufferMinutes must be >= 0");
        }

        List<Appointment> active = repository.findActiveSameDay(
                providerId, AgendaTimestamps.startOfDay(date), AgendaTimestamps.endOfDay(date), INERT);

        List<TimeInterval> busy = new ArrayList<>(active.size());
        for (Appointment a : active) {
            busy.add(new TimeInterval(a.getStart(), a.getEnd().plusMinutes(buffer)));
        }

        List<TimeInterval> free = SlotGenerator.freeIntervals(businessHours.windowsOn(providerId, date), busy);

        List<SlotDTO> slots = new ArrayList<>();
        for (TimeInterval slot : SlotGenerator.slots(free, duration, step)) {
            slots.add(new SlotDTO(slot.start(), slot.end()));
        }
        log.debug("Availability provider={} date={}: {} busy, {} free, {} slots",
                providerId, date, busy.size(), free.size(), slots.size());

        return new AvailabilityDTO(providerId, date, duration, step, buffer, properties.getZone(), slots);
    }
}
