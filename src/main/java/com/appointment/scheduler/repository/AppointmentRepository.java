package com.appointment.scheduler.repository;

import com.appointment.scheduler.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    Optional<Appointment> findByIdAndStatus(Long id, Appointment.Status status);

    List<Appointment> findByStatusAndStartTimeGreaterThanEqualAndStartTimeLessThanOrderByStartTimeAsc(
            Appointment.Status status,
            Instant from,
            Instant to
    );

    @Query("SELECT a.startTime FROM Appointment a WHERE a.status = :status "
            + "AND a.startTime >= :from AND a.startTime < :to")
    List<Instant> findStartTimes(@Param("status") Appointment.Status status,
                                 @Param("from") Instant from,
                                 @Param("to") Instant to);

    /** Start times of ACTIVE appointments in {@code [from, to)}. */
    default Set<Instant> findOccupiedSlots(Instant from, Instant to) {
        return new HashSet<>(findStartTimes(Appointment.Status.ACTIVE, from, to));
    }

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);
}
