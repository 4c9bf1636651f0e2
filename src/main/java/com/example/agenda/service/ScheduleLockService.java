package com.example.agenda.service;

import com.example.agenda.repository.ScheduleLockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Serializes bookings per provider and calendar day through database row locks, so that
 * the conflict check and the commit of a booking are seen by other writers as one step,
 * whichever process they run in.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleLockService {

    private final ScheduleLockRepository repository;
    private final ScheduleLockCreator creator;

    /**
     * Takes write locks on every key, in a fixed order. The locks are released when the
     * surrounding transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lock(Collection<Key> keys) {
        List<Key> ordered = keys.stream()
                .distinct()
                .sorted()
                .toList();
        ordered.forEach(this::lockOne);
    }

    private void lockOne(Key key) {
        if (repository.findForUpdate(key.providerId(), key.day()).isPresent()) {
            return;
        }
        try {
            creator.create(key.providerId(), key.day());
        } catch (DataIntegrityViolationException e) {
            log.debug("Schedule lock {} created concurrently", key);
        }
        repository.findForUpdate(key.providerId(), key.day())
                .orElseThrow(() -> new IllegalStateException("Schedule lock row missing for " + key));
    }

    public record Key(Long providerId, LocalDate day) implements Comparable<Key> {

        private static final Comparator<Key> ORDER = Comparator.comparing(Key::providerId).thenComparing(Key::day);

        @Override
        public int compareTo(Key other) {
            return ORDER.compare(this, other);
        }
    }
}
