package com.appointment.scheduler.service;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Partial update of an appointment. A null field is left unchanged.
 */
@Getter
@Builder
@ToString
public class AppointmentChanges {

    private final Instant startTime;
    private final String name;
    private final String email;
    private final String phone;
    private final String reason;

    public boolean isEmpty() {
        return startTime == null && name == null && email == null && phone == null && reason == null;
    }
}
