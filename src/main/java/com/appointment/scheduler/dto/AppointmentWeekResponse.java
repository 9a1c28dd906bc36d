package com.appointment.scheduler.dto;

import com.appointment.scheduler.scheduling.TimeGrid;
import com.appointment.scheduler.service.AppointmentWeek;
import lombok.Getter;

import java.util.List;

@Getter
public class AppointmentWeekResponse extends WeekPage {

    private final List<AppointmentResponse> appointments;

    public AppointmentWeekResponse(AppointmentWeek week, TimeGrid timeGrid) {
        super(week.week(), timeGrid.getZone(), week.appointments().size());
        this.appointments = week.appointments().stream()
                .map(a -> AppointmentResponse.of(a, timeGrid))
                .toList();
    }
}
