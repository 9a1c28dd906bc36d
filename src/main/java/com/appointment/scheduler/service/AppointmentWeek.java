package com.appointment.scheduler.service;

import com.appointment.scheduler.entity.Appointment;
import com.appointment.scheduler.scheduling.WeekRange;

import java.util.List;

public record AppointmentWeek(WeekRange week, List<Appointment> appointments) {
}
