package com.appointment.scheduler.dto;

public record ErrorResponse(String error, String kind) {
}
