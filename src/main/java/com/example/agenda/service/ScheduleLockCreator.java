package com.example.agenda.service;

import com.example.agenda.model.ScheduleLock;
import com.example.agenda.repository.ScheduleLockRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

/**
 * Inserts lock rows in their own transaction, so a duplicate-key race never marks
 * the booking transaction rollback-only.
 */
@Service
@RequiredArgsConstructor
public class ScheduleLockCreator {

    private final ScheduleLockRepository repository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void create(Long providerId, LocalDate day) {
        repository.saveAndFlush(new ScheduleLock(providerId, day));
    }
}
