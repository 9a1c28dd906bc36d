package com.appointment.scheduler.scheduling;

import java.time.Instant;

/**
 * Half-open week range {@code [start, end)} identified by its page offset.
 */
public record WeekRange(int page, Instant start, Instant end) {

    public boolean contains(Instant t) {
        return !t.isBefore(start) && t.isBefore(end);
    }
}
