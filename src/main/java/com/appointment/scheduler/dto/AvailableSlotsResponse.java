package com.appointment.scheduler.dto;

import com.appointment.scheduler.scheduling.TimeGrid;
import com.appointment.scheduler.service.SlotWeek;
import com.appointment.scheduler.utils.SlotTimes;
import lombok.Getter;

import java.util.List;

@Getter
public class AvailableSlotsResponse extends WeekPage {

    private final List<String> availableSlots;
    private final boolean hasMore;

    public AvailableSlotsResponse(SlotWeek slots, TimeGrid timeGrid) {
        super(slots.week(), timeGrid.getZone(), slots.availableSlots().size());
        this.availableSlots = slots.availableSlots().stream()
                .map(t -> SlotTimes.format(t, timeGrid.getZone()))
                .toList();
        this.hasMore = slots.hasMore();
    }
}
