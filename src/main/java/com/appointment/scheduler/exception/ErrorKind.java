package com.appointment.scheduler.exception;

/**
 * Failure kinds raised by the scheduling engine. Transport codes are assigned
 * at the HTTP boundary, not here.
 */
public enum ErrorKind {
    INVALID_SLOT,
    PAST_BOOKING,
    CONFLICT,
    NOT_FOUND,
    INVALID_PAGE,
    INVALID_REQUEST
}
