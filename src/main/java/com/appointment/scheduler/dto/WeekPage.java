package com.appointment.scheduler.dto;

import com.appointment.scheduler.scheduling.AvailabilityEnumerator;
import com.appointment.scheduler.scheduling.WeekRange;
import com.appointment.scheduler.utils.SlotTimes;
import lombok.Getter;

import java.time.ZoneId;

/**
 * Paging fields shared by the weekly listings.
 */
@Getter
public abstract class WeekPage {

    private final int page;
    private final String weekStart;
    private final String weekEnd;
    private final int count;
    private final boolean hasPrevious;
    private final Integer previousPage;
    private final Integer nextPage;

    protected WeekPage(WeekRange week, ZoneId zone, int count) {
        this.page = week.page();
        this.weekStart = SlotTimes.formatDate(week.start(), zone);
        // last day of the half-open range
        this.weekEnd = SlotTimes.formatDate(week.end().minusSeconds(1), zone);
        this.count = count;
        this.hasPrevious = week.page() > 0;
        this.previousPage = week.page() > 0 ? week.page() - 1 : null;
        this.nextPage = week.page() < AvailabilityEnumerator.MAX_PAGE ? week.page() + 1 : null;
    }
}
