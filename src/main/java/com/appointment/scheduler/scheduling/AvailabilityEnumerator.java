package com.appointment.scheduler.scheduling;

import com.appointment.scheduler.exception.SchedulingException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Free slots of a week: the grid's boundaries minus the past and minus the
 * occupied start times supplied by the caller.
 */
@Component
public class AvailabilityEnumerator {

    /** Furthest week a caller may page to, roughly a century ahead. */
    public static final int MAX_PAGE = 5200;

    private final TimeGrid timeGrid;

    public AvailabilityEnumerator(TimeGrid timeGrid) {
        this.timeGrid = timeGrid;
    }

    public List<Instant> available(int page, Instant now, Set<Instant> occupied) {
        WeekRange week = resolve(page, now);
        return timeGrid.slotBoundaries(week).stream()
                .filter(slot -> slot.isAfter(now))
                .filter(slot -> !occupied.contains(slot))
                .toList();
    }

    /**
     * Whether the week after {@code page} has any slot at all. A valid grid has
     * slots every week, so this only turns false at {@link #MAX_PAGE}; it is
     * kept to back the {@code has_more} paging field.
     */
    public boolean hasMore(int page, Instant now) {
        if (page >= MAX_PAGE) return false;
        return !timeGrid.slotBoundaries(resolve(page + 1, now)).isEmpty();
    }

    public WeekRange resolve(int page, Instant now) {
        if (page < 0 || page > MAX_PAGE) {
            throw SchedulingException.invalidPage(String.valueOf(page), MAX_PAGE);
        }
        return timeGrid.week(page, now);
    }
}
