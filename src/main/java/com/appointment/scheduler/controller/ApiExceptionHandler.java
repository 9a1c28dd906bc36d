package com.appointment.scheduler.controller;

import com.appointment.scheduler.dto.ErrorResponse;
import com.appointment.scheduler.exception.ErrorKind;
import com.appointment.scheduler.exception.SchedulingException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps engine failures to HTTP statuses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SchedulingException.class)
    public ResponseEntity<ErrorResponse> handleScheduling(SchedulingException e) {
        HttpStatus status = statusOf(e.getKind());
        log.debug("Request rejected: {} {}", e.getKind(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(e.getMessage(), e.getKind().name()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        String message = "Malformed request body.";
        if (e.getCause() instanceof UnrecognizedPropertyException unknown) {
            message = "Unsupported fields supplied: " + unknown.getPropertyName();
        }
        return ResponseEntity.badRequest().body(new ErrorResponse(message, ErrorKind.INVALID_REQUEST.name()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "Invalid value for " + e.getName() + ": " + e.getValue(), ErrorKind.INVALID_REQUEST.name()));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFLICT:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }
}
