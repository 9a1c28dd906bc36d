package com.appointment.scheduler.service;

import com.appointment.scheduler.entity.Appointment;
import com.appointment.scheduler.exception.SchedulingException;
import com.appointment.scheduler.repository.AppointmentRepository;
import com.appointment.scheduler.scheduling.AvailabilityEnumerator;
import com.appointment.scheduler.scheduling.ConflictGuard;
import com.appointment.scheduler.scheduling.SlotValidator;
import com.appointment.scheduler.scheduling.WeekRange;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Create, reschedule, cancel and query appointments.
 * <p>
 * Each write runs in one transaction: every check happens before the row is
 * touched, and the slot itself is claimed through {@link ConflictGuard}.
 * Cancelled appointments are not addressable: get, update and cancel all
 * answer NOT_FOUND for them.
 */
@Service
public class AppointmentService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentService.class);

    private static final int MAX_NAME_LENGTH = 255;
    private static final int MAX_EMAIL_LENGTH = 255;
    private static final int MAX_PHONE_LENGTH = 50;
    private static final int MAX_REASON_LENGTH = 200;
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final AppointmentRepository appointmentRepository;
    private final SlotValidator slotValidator;
    private final AvailabilityEnumerator availabilityEnumerator;
    private final ConflictGuard conflictGuard;

    public AppointmentService(AppointmentRepository appointmentRepository,
                              SlotValidator slotValidator,
                              AvailabilityEnumerator availabilityEnumerator,
                              ConflictGuard conflictGuard) {
        this.appointmentRepository = appointmentRepository;
        this.slotValidator = slotValidator;
        this.availabilityEnumerator = availabilityEnumerator;
        this.conflictGuard = conflictGuard;
    }

    // =========================================================
    // CREATE
    // =========================================================
    @Transactional
    public Appointment create(Instant startTime, String name, String email, String phone, String reason, Instant now) {
        if (startTime == null) {
            throw SchedulingException.invalidRequest("start_time, name, and email are required fields.");
        }
        String cleanName = requireName(name);
        String cleanEmail = requireEmail(email);
        String cleanPhone = cleanPhone(phone);
        String cleanReason = cleanReason(reason);

        slotValidator.validate(startTime, now);

        Appointment appointment = Appointment.builder()
                .name(cleanName)
                .email(cleanEmail)
                .phone(cleanPhone)
                .reason(cleanReason)
                .status(Appointment.Status.ACTIVE)
                .build();
        appointment = conflictGuard.claim(appointment, startTime);

        log.info("Booked appointment {} at {} for {}", appointment.getId(), startTime, cleanEmail);
        return appointment;
    }

    // =========================================================
    // UPDATE / RESCHEDULE
    // =========================================================
    @Transactional
    public Appointment update(Long id, AppointmentChanges changes, Instant now) {
        Appointment appointment = lockActive(id);
        if (changes == null || changes.isEmpty()) {
            return appointment;
        }

        String name = changes.getName() != null ? requireName(changes.getName()) : null;
        String email = changes.getEmail() != null ? requireEmail(changes.getEmail()) : null;
        String phone = changes.getPhone() != null ? cleanPhone(changes.getPhone()) : null;
        String reason = changes.getReason() != null ? cleanReason(changes.getReason()) : null;
        Instant newStart = changes.getStartTime();
        if (newStart != null) {
            slotValidator.validate(newStart, now);
        }

        if (name != null) appointment.setName(name);
        if (email != null) appointment.setEmail(email);
        if (phone != null) appointment.setPhone(phone);
        if (reason != null) appointment.setReason(reason);

        if (newStart == null) {
            return appointmentRepository.saveAndFlush(appointment);
        }

        Instant previous = appointment.getStartTime();
        appointment = conflictGuard.claim(appointment, newStart);
        if (!previous.equals(newStart)) {
            log.info("Rescheduled appointment {} from {} to {}", id, previous, newStart);
        }
        return appointment;
    }

    // =========================================================
    // CANCEL
    // =========================================================
    @Transactional
    public void cancel(Long id) {
        Appointment appointment = lockActive(id);
        Instant released = appointment.getStartTime();
        appointment.cancel();
        appointmentRepository.saveAndFlush(appointment);
        log.info("Cancelled appointment {}, slot {} released", id, released);
    }

    // =========================================================
    // QUERIES
    // =========================================================
    @Transactional(readOnly = true)
    public Appointment get(Long id) {
        if (id == null) throw SchedulingException.notFound(null);
        return appointmentRepository.findByIdAndStatus(id, Appointment.Status.ACTIVE)
                .orElseThrow(() -> SchedulingException.notFound(id));
    }

    @Transactional(readOnly = true)
    public AppointmentWeek listWeek(int page, Instant now) {
        WeekRange week = availabilityEnumerator.resolve(page, now);
        List<Appointment> appointments = appointmentRepository
                .findByStatusAndStartTimeGreaterThanEqualAndStartTimeLessThanOrderByStartTimeAsc(
                        Appointment.Status.ACTIVE, week.start(), week.end());
        return new AppointmentWeek(week, appointments);
    }

    @Transactional(readOnly = true)
    public SlotWeek availableSlots(int page, Instant now) {
        WeekRange week = availabilityEnumerator.resolve(page, now);
        Set<Instant> occupied = appointmentRepository.findOccupiedSlots(week.start(), week.end());
        List<Instant> slots = availabilityEnumerator.available(page, now, occupied);
        log.debug("Week {} ({} - {}): {} occupied, {} available", page, week.start(), week.end(),
                occupied.size(), slots.size());
        return new SlotWeek(week, slots, availabilityEnumerator.hasMore(page, now));
    }

    // =========================================================
    // HELPERS
    // =========================================================
    private Appointment lockActive(Long id) {
        if (id == null) throw SchedulingException.notFound(null);
        return appointmentRepository.findByIdForUpdate(id)
                .filter(Appointment::isActive)
                .orElseThrow(() -> SchedulingException.notFound(id));
    }

    private static String requireName(String raw) {
        String name = StringUtils.strip(raw);
        if (StringUtils.isEmpty(name)) {
            throw SchedulingException.invalidRequest("Name cannot be blank.");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw SchedulingException.invalidRequest("Name cannot exceed " + MAX_NAME_LENGTH + " characters.");
        }
        return name;
    }

    private static String requireEmail(String raw) {
        String email = StringUtils.strip(raw);
        if (StringUtils.isEmpty(email)) {
            throw SchedulingException.invalidRequest("Email cannot be blank.");
        }
        if (email.length() > MAX_EMAIL_LENGTH) {
            throw SchedulingException.invalidRequest("Email cannot exceed " + MAX_EMAIL_LENGTH + " characters.");
        }
        if (!EMAIL.matcher(email).matches()) {
            throw SchedulingException.invalidRequest("Enter a valid email address.");
        }
        return email;
    }

    private static String cleanPhone(String raw) {
        String phone = StringUtils.defaultString(StringUtils.strip(raw));
        if (phone.length() > MAX_PHONE_LENGTH) {
            throw SchedulingException.invalidRequest("Phone cannot exceed " + MAX_PHONE_LENGTH + " characters.");
        }
        return phone;
    }

    private static String cleanReason(String raw) {
        String reason = StringUtils.defaultString(StringUtils.strip(raw));
        if (reason.length() > MAX_REASON_LENGTH) {
            throw SchedulingException.invalidRequest("Reason cannot exceed " + MAX_REASON_LENGTH + " characters.");
        }
        return reason;
    }
}
