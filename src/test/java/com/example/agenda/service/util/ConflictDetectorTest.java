package com.example.agenda.service.util;

import com.example.agenda.model.Appointment;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ConflictDetectorTest {

    private static final LocalDateTime EIGHT = LocalDateTime.of(2025, 3, 10, 8, 0);

    @Test
    void shouldReportOverlappingActiveAppointment() {
        Appointment existing = appointment(1L, 1L, EIGHT, 30, Appointment.Status.SCHEDULED);

        Optional<Appointment> conflict = ConflictDetector.findConflict(1L, EIGHT.plusMinutes(15), 30, List.of(existing), null);

        assertThat(conflict).contains(existing);
    }

    @Test
    void shouldNotConflictWhenNewAppointmentStartsExactlyAtPreviousEnd() {
        Appointment existing = appointment(1L, 1L, EIGHT, 30, Appointment.Status.CONFIRMED);

        assertThat(ConflictDetector.findConflict(1L, EIGHT.plusMinutes(30), 30, List.of(existing), null)).isEmpty();
    }

    @Test
    void shouldNotConflictWhenNewAppointmentEndsExactlyAtNextStart() {
        Appointment existing = appointment(1L, 1L, EIGHT, 30, Appointment.Status.SCHEDULED);

        assertThat(ConflictDetector.findConflict(1L, EIGHT.minusMinutes(45), 45, List.of(existing), null)).isEmpty();
    }

    @Test
    void shouldIgnoreCancelledAndNoShowAppointments() {
        List<Appointment> existing = List.of(
                appointment(1L, 1L, EIGHT, 60, Appointment.Status.CANCELLED),
                appointment(2L, 1L, EIGHT, 60, Appointment.Status.NO_SHOW));

        assertThat(ConflictDetector.findConflict(1L, EIGHT, 30, existing, null)).isEmpty();
    }

    @Test
    void shouldStillBlockOnCompletedAppointment() {
        Appointment completed = appointment(1L, 1L, EIGHT, 60, Appointment.Status.COMPLETED);

        assertThat(ConflictDetector.findConflict(1L, EIGHT.plusMinutes(10), 10, List.of(completed), null)).contains(completed);
    }

    @Test
    void shouldIgnoreOtherProvidersAndOtherDays() {
        List<Appointment> existing = List.of(
                appointment(1L, 2L, EIGHT, 60, Appointment.Status.SCHEDULED),
                appointment(2L, 1L, EIGHT.plusDays(1), 60, Appointment.Status.SCHEDULED));

        assertThat(ConflictDetector.findConflict(1L, EIGHT, 30, existing, null)).isEmpty();
    }

    @Test
    void shouldExcludeTheAppointmentBeingMoved() {
        Appointment self = appointment(7L, 1L, EIGHT, 30, Appointment.Status.SCHEDULED);

        assertThat(ConflictDetector.findConflict(1L, EIGHT.plusMinutes(10), 30, List.of(self), 7L)).isEmpty();
        assertThat(ConflictDetector.findConflict(1L, EIGHT.plusMinutes(10), 30, List.of(self), null)).contains(self);
    }

    @Test
    void shouldReturnFirstMatchInSuppliedOrder() {
        Appointment first = appointment(3L, 1L, EIGHT, 30, Appointment.Status.SCHEDULED);
        Appointment second = appointment(4L, 1L, EIGHT.plusMinutes(30), 30, Appointment.Status.SCHEDULED);

        assertThat(ConflictDetector.findConflict(1L, EIGHT, 60, List.of(second, first), null)).contains(second);
    }

    @Test
    void shouldReturnEmptyForNoCandidates() {
        assertThat(ConflictDetector.findConflict(1L, EIGHT, 30, List.of(), null)).isEmpty();
        assertThat(ConflictDetector.findConflict(1L, EIGHT, 30, null, null)).isEmpty();
    }

    static Appointment appointment(Long id, Long providerId, LocalDateTime start, int minutes, Appointment.Status status) {
        Appointment a = new Appointment();
        a.setId(id);
        a.setProviderId(providerId);
        a.setCustomerRef(100L + id);
        a.setStart(start);
        a.setDurationMinutes(minutes);
        a.setStatus(status);
        return a;
    }
}
