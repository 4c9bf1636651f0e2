package com.example.agenda.service.util;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Set arithmetic over half-open {@link TimeInterval}s. Inputs are never modified.
 */
public final class IntervalAlgebra {

    private IntervalAlgebra() {
    }

    /**
     * Sorts by start and folds overlapping or touching intervals together.
     *
     * @return ascending, pairwise disjoint and non-adjacent intervals
     */
    public static List<TimeInterval> merge(Collection<TimeInterval> intervals) {
        if (intervals == null || intervals.isEmpty()) {
            return Collections.emptyList();
        }

        List<TimeInterval> sorted = new ArrayList<>(intervals);
        sorted.sort(TimeInterval.BY_START);

        List<TimeInterval> merged = new ArrayList<>();
        TimeInterval current = sorted.get(0);
        for (int i = 1; i < sorted.size(); i++) {
            TimeInterval next = sorted.get(i);
            if (!next.start().isAfter(current.end())) {
                LocalDateTime end = next.end().isAfter(current.end()) ? next.end() : current.end();
                current = new TimeInterval(current.start(), end);
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return merged;
    }

    /**
     * Free parts of {@code base} not covered by any interval of {@code busy}.
     * {@code base} is expected sorted and disjoint; {@code busy} may be in any order.
     */
    public static List<TimeInterval> subtract(List<TimeInterval> base, Collection<TimeInterval> busy) {
        if (base == null || base.isEmpty()) {
            return Collections.emptyList();
        }
        List<TimeInterval> sortedBusy = busy == null ? List.of() : new ArrayList<>(busy);
        if (!sortedBusy.isEmpty()) {
            sortedBusy.sort(TimeInterval.BY_START);
        }

        List<TimeInterval> free = new ArrayList<>();
        for (TimeInterval window : base) {
            LocalDateTime cursor = window.start();
            for (TimeInterval taken : sortedBusy) {
                if (!taken.overlaps(window)) {
                    continue;
                }
                if (taken.start().isAfter(cursor)) {
                    free.add(new TimeInterval(cursor, taken.start()));
                }
                if (taken.end().isAfter(cursor)) {
                    cursor = taken.end();
                }
                if (!cursor.isBefore(window.end())) {
                    break;
                }
            }
            if (cursor.isBefore(window.end())) {
                free.add(new TimeInterval(cursor, window.end()));
            }
        }
        return free;
    }
}
