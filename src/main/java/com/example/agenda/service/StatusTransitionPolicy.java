package com.example.agenda.service;

import com.example.agenda.model.Appointment.Status;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether an appointment may move from one status to another.
 */
@FunctionalInterface
public interface StatusTransitionPolicy {

    boolean allows(Status from, Status to);

    /** Any status to any status. */
    StatusTransitionPolicy PERMISSIVE = (from, to) -> true;

    /** scheduled -> confirmed -> completed, with cancel/no-show exits until completion. */
    StatusTransitionPolicy STRICT = new StatusTransitionPolicy() {

        private final Map<Status, Set<Status>> graph = buildGraph();

        @Override
        public boolean allows(Status from, Status to) {
            return from == to || graph.getOrDefault(from, Set.of()).contains(to);
        }

        private Map<Status, Set<Status>> buildGraph() {
            Map<Status, Set<Status>> g = new EnumMap<>(Status.class);
            g.put(Status.SCHEDULED, EnumSet.of(Status.CONFIRMED, Status.CANCELLED, Status.NO_SHOW));
            g.put(Status.CONFIRMED, EnumSet.of(Status.COMPLETED, Status.CANCELLED, Status.NO_SHOW));
            return g;
        }

        @Override
        public String toString() {
            return "strict";
        }
    };

    static StatusTransitionPolicy named(String name) {
        if (name == null || name.isBlank() || "permissive".equalsIgnoreCase(name.trim())) {
            return PERMISSIVE;
        }
        if ("strict".equalsIgnoreCase(name.trim())) {
            return STRICT;
        }
        throw new IllegalArgumentException("Unknown status policy: " + name);
    }
}
