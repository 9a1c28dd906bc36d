package com.appointment.scheduler.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Body of a booking request. Also used for partial updates, where any field
 * left out keeps its current value.
 */
@Getter
@Setter
@NoArgsConstructor
@ToString
public class AppointmentRequest {

    private String startTime;
    private String name;
    private String email;
    private String phone;
    private String reason;
}
