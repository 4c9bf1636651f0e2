package com.example.agenda.repository;

import com.example.agenda.model.Appointment;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Appointment a where a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);

    /** Every appointment of the provider starting in {@code [dayStart, dayEnd)}, in id order. */
    @Query("select a from Appointment a where a.providerId = :providerId "
            + "and a.start >= :dayStart and a.start < :dayEnd order by a.id")
    List<Appointment> findSameDay(@Param("providerId") Long providerId,
                                  @Param("dayStart") LocalDateTime dayStart,
                                  @Param("dayEnd") LocalDateTime dayEnd);

    @Query("select a from Appointment a where a.providerId = :providerId "
            + "and a.start >= :dayStart and a.start < :dayEnd and a.status not in :inert order by a.start")
    List<Appointment> findActiveSameDay(@Param("providerId") Long providerId,
                                        @Param("dayStart") LocalDateTime dayStart,
                                        @Param("dayEnd") LocalDateTime dayEnd,
                                        @Param("inert") Collection<Appointment.Status> inert);

    List<Appointment> findByStartBetweenOrderByStartAsc(LocalDateTime from, LocalDateTime to);

    List<Appointment> findByProviderIdAndStartBetweenOrderByStartAsc(Long providerId, LocalDateTime from, LocalDateTime to);
}
