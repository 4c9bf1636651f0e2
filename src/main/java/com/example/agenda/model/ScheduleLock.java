package com.example.agenda.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Row-lock target for one provider's calendar day. Bookings touching that day
 * take a write lock on this row before reading and committing appointments.
 */
@Entity
@Table(name = "schedule_locks",
        uniqueConstraints = @UniqueConstraint(name = "uk_schedule_locks_provider_day", columnNames = {"provider_id", "lock_day"}))
@Getter @Setter
@NoArgsConstructor
public class ScheduleLock {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_id", nullable = false)
    private Long providerId;

    @Column(name = "lock_day", nullable = false)
    private LocalDate day;

    public ScheduleLock(Long providerId, LocalDate day) {
        this.providerId = providerId;
        this.day = day;
    }
}
