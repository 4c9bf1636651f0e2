package com.example.agenda.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;

@Entity
@Table(name = "appointments", indexes = {
        @Index(name = "idx_appointments_provider_start", columnList = "provider_id,start_at")
})
@Getter @Setter
public class Appointment {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long customerRef;

    private Long serviceRef;

    @Column(name = "provider_id", nullable = false)
    private Long providerId;

    /** Wall-clock time in the business zone. */
    @Column(name = "start_at", nullable = false)
    private LocalDateTime start;

    @Column(nullable = false)
    private Integer durationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status = Status.SCHEDULED;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BookingChannel bookingChannel = BookingChannel.ONLINE;

    @Column(precision = 12, scale = 2)
    private BigDecimal price;

    @Column(length = 1000)
    private String notes;

    /** Exclusive end of the booked window. */
    public LocalDateTime getEnd() {
        return start.plusMinutes(durationMinutes);
    }

    public boolean isActive() {
        return status.isActive();
    }

    public enum Status {
        SCHEDULED("scheduled"),
        CONFIRMED("confirmed"),
        COMPLETED("completed"),
        CANCELLED("cancelled"),
        NO_SHOW("no_show");

        private final String code;

        Status(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }

        /** Cancelled and no-show appointments never block a provider. */
        public boolean isActive() {
            return this != CANCELLED && this != NO_SHOW;
        }

        @JsonCreator
        public static Status fromCode(String raw) {
            return Arrays.stream(values())
                    .filter(s -> s.code.equalsIgnoreCase(raw) || s.name().equalsIgnoreCase(raw))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown appointment status: " + raw));
        }
    }

    public enum BookingChannel {
        ONLINE("online"),
        PHONE("phone"),
        WALK_IN("walk_in");

        private final String code;

        BookingChannel(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }

        @JsonCreator
        public static BookingChannel fromCode(String raw) {
            return Arrays.stream(values())
                    .filter(c -> c.code.equalsIgnoreCase(raw) || c.name().equalsIgnoreCase(raw))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown booking channel: " + raw));
        }
    }
}
