package com.appointment.scheduler.exception;

import java.time.Instant;

/**
 * Raised for every rejected scheduling request. Thrown from inside a
 * transactional service method it also rolls the surrounding write back.
 */
public class SchedulingException extends RuntimeException {

    private final ErrorKind kind;

    public SchedulingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SchedulingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static SchedulingException invalidSlot(String message) {
        return new SchedulingException(ErrorKind.INVALID_SLOT, message);
    }

    public static SchedulingException pastBooking() {
        return new SchedulingException(ErrorKind.PAST_BOOKING, "Cannot book an appointment in the past.");
    }

    public static SchedulingException conflict(Instant startTime, Throwable cause) {
        return new SchedulingException(ErrorKind.CONFLICT,
                "This time slot has already been booked: " + startTime, cause);
    }

    public static SchedulingException notFound(Long id) {
        return new SchedulingException(ErrorKind.NOT_FOUND,
                id == null ? "Appointment not found." : "Appointment not found: " + id);
    }

    public static SchedulingException invalidPage(String page, int maxPage) {
        return new SchedulingException(ErrorKind.INVALID_PAGE,
                "Page must be an integer between 0 and " + maxPage + ", got: " + page);
    }

    public static SchedulingException invalidRequest(String message) {
        return new SchedulingException(ErrorKind.INVALID_REQUEST, message);
    }
}
