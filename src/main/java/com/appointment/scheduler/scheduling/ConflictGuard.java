package com.appointment.scheduler.scheduling;

import com.appointment.scheduler.entity.Appointment;
import com.appointment.scheduler.exception.SchedulingException;
import com.appointment.scheduler.repository.AppointmentRepository;
import org.apache.commons.lang3.StringUtils;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Admits an appointment into a slot with one conditional write.
 * <p>
 * The slot is claimed by setting the row's {@code slot_key} and flushing it;
 * the unique constraint on that column settles concurrent claims, so there is
 * no separate occupancy read. A row moved within its own transaction replaces
 * its previous key in the same statement and cannot collide with itself.
 */
@Component
public class ConflictGuard {

    private static final Logger log = LoggerFactory.getLogger(ConflictGuard.class);

    private final AppointmentRepository appointmentRepository;

    public ConflictGuard(AppointmentRepository appointmentRepository) {
        this.appointmentRepository = appointmentRepository;
    }

    /**
     * Claims {@code startTime} for the given appointment, new or existing.
     * Must run inside the caller's transaction.
     *
     * @throws SchedulingException with kind CONFLICT if another active appointment holds the slot
     * @throws DataIntegrityViolationException for any other constraint, unchanged
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Appointment claim(Appointment appointment, Instant startTime) {
        appointment.occupy(startTime);
        try {
            return appointmentRepository.saveAndFlush(appointment);
        } catch (DataIntegrityViolationException e) {
            if (!isSlotKeyViolation(e)) {
                throw e;
            }
            log.warn("Slot {} already taken, rejecting appointment {}", startTime,
                    appointment.getId() != null ? appointment.getId() : "(new)");
            throw SchedulingException.conflict(startTime, e);
        }
    }

    static boolean isSlotKeyViolation(DataIntegrityViolationException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException cve
                    && StringUtils.containsIgnoreCase(cve.getConstraintName(), Appointment.SLOT_KEY_CONSTRAINT)) {
                return true;
            }
            if (StringUtils.containsIgnoreCase(t.getMessage(), Appointment.SLOT_KEY_CONSTRAINT)) {
                return true;
            }
        }
        return false;
    }
}
