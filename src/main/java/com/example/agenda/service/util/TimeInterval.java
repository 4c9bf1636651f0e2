package com.example.agenda.service.util;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Objects;

/**
 * Half-open time range {@code [start, end)}.
 */
public record TimeInterval(LocalDateTime start, LocalDateTime end) {

    public static final Comparator<TimeInterval> BY_START = Comparator.comparing(TimeInterval::start);

    public TimeInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Interval end " + end + " is before start " + start);
        }
    }

    public static TimeInterval ofMinutes(LocalDateTime start, long minutes) {
        return new TimeInterval(start, start.plusMinutes(minutes));
    }

    /** Strict overlap: touching intervals do not overlap. */
    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && end.isAfter(other.start);
    }

    public boolean contains(TimeInterval other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public long durationMinutes() {
        return Duration.between(start, end).toMinutes();
    }
}
