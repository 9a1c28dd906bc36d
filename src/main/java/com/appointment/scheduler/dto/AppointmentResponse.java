package com.appointment.scheduler.dto;

import com.appointment.scheduler.entity.Appointment;
import com.appointment.scheduler.scheduling.TimeGrid;
import com.appointment.scheduler.utils.SlotTimes;
import lombok.Builder;
import lombok.Getter;

import java.time.ZoneId;

@Getter
@Builder
public class AppointmentResponse {

    private final Long id;
    private final String startTime;
    private final String endTime;
    private final String name;
    private final String email;
    private final String phone;
    private final String reason;
    private final String status;
    private final String createdAt;

    public static AppointmentResponse of(Appointment appointment, TimeGrid timeGrid) {
        ZoneId zone = timeGrid.getZone();
        return AppointmentResponse.builder()
                .id(appointment.getId())
                .startTime(SlotTimes.format(appointment.getStartTime(), zone))
                .endTime(SlotTimes.format(timeGrid.slotEnd(appointment.getStartTime()), zone))
                .name(appointment.getName())
                .email(appointment.getEmail())
                .phone(appointment.getPhone() != null ? appointment.getPhone() : "")
                .reason(appointment.getReason() != null ? appointment.getReason() : "")
                .status(appointment.getStatus().name())
                .createdAt(SlotTimes.format(appointment.getCreatedAt(), zone))
                .build();
    }
}
