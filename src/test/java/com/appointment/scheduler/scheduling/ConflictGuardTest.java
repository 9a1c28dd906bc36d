package com.appointment.scheduler.scheduling;

import com.appointment.scheduler.entity.Appointment;
import com.appointment.scheduler.exception.ErrorKind;
import com.appointment.scheduler.exception.SchedulingException;
import com.appointment.scheduler.repository.AppointmentRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConflictGuardTest {

    private static final Instant SLOT = Instant.parse("2025-11-11T09:00:00Z");

    private final AppointmentRepository repository = mock(AppointmentRepository.class);
    private final ConflictGuard guard = new ConflictGuard(repository);

    private static Appointment newAppointment() {
        return Appointment.builder().name("Ada").email("ada@example.com").build();
    }

    @Test
    void claim_shouldStampSlotKeyAndSave() {
        when(repository.saveAndFlush(any(Appointment.class))).thenAnswer(inv -> inv.getArgument(0));

        Appointment saved = guard.claim(newAppointment(), SLOT);

        assertThat(saved.getStartTime()).isEqualTo(SLOT);
        assertThat(saved.getSlotKey()).isEqualTo(SLOT);
    }

    @Test
    void claim_shouldReportConflictForSlotKeyViolation() {
        ConstraintViolationException cause = new ConstraintViolationException("could not execute statement",
                new SQLException("Unique index or primary key violation", "23505"),
                "PUBLIC.UK_APPOINTMENT_SLOT_KEY_INDEX_A");
        when(repository.saveAndFlush(any(Appointment.class)))
                .thenThrow(new DataIntegrityViolationException("could not execute statement", cause));

        SchedulingException e = assertThrows(SchedulingException.class, () -> guard.claim(newAppointment(), SLOT));

        assertThat(e.getKind()).isEqualTo(ErrorKind.CONFLICT);
    }

    @Test
    void claim_shouldRecognisePostgresMessage() {
        when(repository.saveAndFlush(any(Appointment.class))).thenThrow(new DataIntegrityViolationException(
                "duplicate key value violates unique constraint \"uk_appointment_slot_key\""));

        SchedulingException e = assertThrows(SchedulingException.class, () -> guard.claim(newAppointment(), SLOT));

        assertThat(e.getKind()).isEqualTo(ErrorKind.CONFLICT);
    }

    @Test
    void claim_shouldPassOtherIntegrityErrorsThrough() {
        DataIntegrityViolationException tooLong = new DataIntegrityViolationException(
                "Value too long for column \"EMAIL CHARACTER VARYING(255)\"",
                new ConstraintViolationException("could not execute statement",
                        new SQLException("Value too long", "22001"), null));
        when(repository.saveAndFlush(any(Appointment.class))).thenThrow(tooLong);

        DataIntegrityViolationException e = assertThrows(DataIntegrityViolationException.class,
                () -> guard.claim(newAppointment(), SLOT));

        assertSame(tooLong, e);
    }
}
