package com.example.agenda.service.util;

import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Slides a fixed-length window across free intervals.
 */
public final class SlotGenerator {

    private SlotGenerator() {
    }

    /**
     * Free time inside {@code businessHours} once {@code busy} is taken out.
     */
    public static List<TimeInterval> freeIntervals(List<TimeInterval> businessHours, List<TimeInterval> busy) {
        return IntervalAlgebra.subtract(IntervalAlgebra.merge(businessHours), IntervalAlgebra.merge(busy));
    }

    /**
     * Every {@code durationMinutes} long window that starts at a free interval's start
     * plus a multiple of {@code stepMinutes} and ends no later than that interval.
     * The result is computed lazily and can be iterated any number of times.
     */
    public static Iterable<TimeInterval> slots(List<TimeInterval> free, int durationMinutes, int stepMinutes) {
        if (durationMinutes <= 0) {
            throw new IllegalArgumentException("durationMinutes must be > 0, got " + durationMinutes);
        }
        if (stepMinutes <= 0) {
            throw new IllegalArgumentException("stepMinutes must be > 0, got " + stepMinutes);
        }
        List<TimeInterval> snapshot = List.copyOf(free);
        return () -> new SlotIterator(snapshot, durationMinutes, stepMinutes);
    }

    private static final class SlotIterator implements Iterator<TimeInterval> {

        private final List<TimeInterval> free;
        private final int durationMinutes;
        private final int stepMinutes;

        private int index;
        private LocalDateTime cursor;

        SlotIterator(List<TimeInterval> free, int durationMinutes, int stepMinutes) {
            this.free = free;
            this.durationMinutes = durationMinutes;
            this.stepMinutes = stepMinutes;
            this.cursor = free.isEmpty() ? null : free.get(0).start();
        }

        @Override
        public boolean hasNext() {
            while (index < free.size()) {
                if (!cursor.plusMinutes(durationMinutes).isAfter(free.get(index).end())) {
                    return true;
                }
                index++;
                if (index < free.size()) {
                    cursor = free.get(index).start();
                }
            }
            return false;
        }

        @Override
        public TimeInterval next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            TimeInterval slot = TimeInterval.ofMinutes(cursor, durationMinutes);
            cursor = cursor.plusMinutes(stepMinutes);
            return slot;
        }
    }
}
