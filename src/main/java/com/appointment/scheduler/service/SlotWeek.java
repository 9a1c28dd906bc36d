package com.appointment.scheduler.service;

import com.appointment.scheduler.scheduling.WeekRange;

import java.time.Instant;
import java.util.List;

/**
 * Free slots of one week plus whether a following week has any slots.
 */
public record SlotWeek(WeekRange week, List<Instant> availableSlots, boolean hasMore) {
}
