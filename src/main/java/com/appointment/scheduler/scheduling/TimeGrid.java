package com.appointment.scheduler.scheduling;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Business hours, slot length and week boundaries. Immutable and free of
 * side effects, so a single instance is shared by every request.
 */
public final class TimeGrid {

    private static final int DAYS_PER_WEEK = 7;

    private final LocalTime open;
    private final LocalTime close;
    private final Duration slotLength;
    private final Set<DayOfWeek> businessDays;
    private final ZoneId zone;
    private final DayOfWeek firstDayOfWeek;

    private final long openSecond;
    private final long closeSecond;
    private final long slotSeconds;

    public TimeGrid(LocalTime open,
                    LocalTime close,
                    Duration slotLength,
                    Set<DayOfWeek> businessDays,
                    ZoneId zone,
                    DayOfWeek firstDayOfWeek) {
        if (open == null || close == null || slotLength == null || zone == null || firstDayOfWeek == null) {
            throw new IllegalStateException("Time grid configuration is incomplete");
        }
        if (!close.isAfter(open)) {
            throw new IllegalStateException("Closing time " + close + " must be after opening time " + open);
        }
        if (slotLength.isNegative() || slotLength.isZero() || slotLength.getNano() != 0) {
            throw new IllegalStateException("Slot length must be a positive whole number of seconds: " + slotLength);
        }
        if (slotLength.compareTo(Duration.between(open, close)) > 0) {
            throw new IllegalStateException("Slot length " + slotLength + " does not fit between " + open + " and " + close);
        }
        if (businessDays == null || businessDays.isEmpty()) {
            throw new IllegalStateException("At least one business day is required");
        }
        this.open = open;
        this.close = close;
        this.slotLength = slotLength;
        this.businessDays = Collections.unmodifiableSet(EnumSet.copyOf(businessDays));
        this.zone = zone;
        this.firstDayOfWeek = firstDayOfWeek;
        this.openSecond = open.toSecondOfDay();
        this.closeSecond = close.toSecondOfDay();
        this.slotSeconds = slotLength.getSeconds();
    }

    /**
     * Week for the given page offset, page 0 being the week that contains {@code now}.
     */
    public WeekRange week(int page, Instant now) {
        LocalDate firstDay = now.atZone(zone).toLocalDate()
                .with(TemporalAdjusters.previousOrSame(firstDayOfWeek))
                .plusWeeks(page);
        Instant start = firstDay.atStartOfDay(zone).toInstant();
        Instant end = firstDay.plusDays(DAYS_PER_WEEK).atStartOfDay(zone).toInstant();
        return new WeekRange(page, start, end);
    }

    /**
     * Every slot start in the week whose whole slot falls inside business
     * hours on a business day, ascending.
     */
    public List<Instant> slotBoundaries(WeekRange week) {
        LocalDate firstDay = week.start().atZone(zone).toLocalDate();
        List<Instant> slots = new ArrayList<>();
        for (int d = 0; d < DAYS_PER_WEEK; d++) {
            LocalDate date = firstDay.plusDays(d);
            if (!businessDays.contains(date.getDayOfWeek())) continue;
            for (long s = openSecond; s + slotSeconds <= closeSecond; s += slotSeconds) {
                Instant slot = ZonedDateTime.of(date, LocalTime.ofSecondOfDay(s), zone).toInstant();
                if (week.contains(slot)) {
                    slots.add(slot);
                }
            }
        }
        return Collections.unmodifiableList(slots);
    }

    /**
     * True iff {@code t} starts a slot: on a business day, on the grid counted
     * from opening time, and ending no later than closing time.
     */
    public boolean isAligned(Instant t) {
        if (t == null) return false;
        ZonedDateTime local = t.atZone(zone);
        if (!businessDays.contains(local.getDayOfWeek())) return false;
        LocalTime time = local.toLocalTime();
        if (time.getNano() != 0) return false;
        long second = time.toSecondOfDay();
        if (second < openSecond || second + slotSeconds > closeSecond) return false;
        if ((second - openSecond) % slotSeconds != 0) return false;
        // wall clock must round-trip, otherwise t sits in a DST gap or overlap
        return ZonedDateTime.of(local.toLocalDate(), time, zone).toInstant().equals(t);
    }

    public Instant slotEnd(Instant start) {
        return start.plus(slotLength);
    }

    public LocalTime getOpen() {
        return open;
    }

    public LocalTime getClose() {
        return close;
    }

    public Duration getSlotLength() {
        return slotLength;
    }

    public Set<DayOfWeek> getBusinessDays() {
        return businessDays;
    }

    public ZoneId getZone() {
        return zone;
    }

    public DayOfWeek getFirstDayOfWeek() {
        return firstDayOfWeek;
    }

    @Override
    public String toString() {
        return "TimeGrid{" + open + "-" + close + ", slot=" + slotLength + ", days=" + businessDays + ", zone=" + zone + "}";
    }
}
