package com.example.agenda.repository;

import com.example.agenda.model.ScheduleLock;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Optional;

public interface ScheduleLockRepository extends JpaRepository<ScheduleLock, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from ScheduleLock l where l.providerId = :providerId and l.day = :day")
    Optional<ScheduleLock> findForUpdate(@Param("providerId") Long providerId, @Param("day") LocalDate day);

    boolean existsByProviderIdAndDay(Long providerId, LocalDate day);
}
