package com.appointment.scheduler.config;

import com.appointment.scheduler.scheduling.TimeGrid;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the time grid once at startup. A bad value stops the application.
 */
@Configuration
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    public TimeGrid timeGrid(
            @Value("${scheduler.business-hours.open:09:00}") String open,
            @Value("${scheduler.business-hours.close:17:00}") String close,
            @Value("${scheduler.slot-minutes:30}") int slotMinutes,
            @Value("${scheduler.business-days:MONDAY,TUESDAY,WEDNESDAY,THURSDAY,FRIDAY}") String businessDays,
            @Value("${scheduler.zone:UTC}") String zone,
            @Value("${scheduler.first-day-of-week:MONDAY}") String firstDayOfWeek) {
        TimeGrid grid;
        try {
            grid = new TimeGrid(
                    LocalTime.parse(StringUtils.trim(open)),
                    LocalTime.parse(StringUtils.trim(close)),
                    Duration.ofMinutes(slotMinutes),
                    parseDays(businessDays),
                    ZoneId.of(StringUtils.trim(zone)),
                    parseDay(firstDayOfWeek));
        } catch (DateTimeException | IllegalArgumentException e) {
            throw new IllegalStateException("Invalid scheduler configuration: " + e.getMessage(), e);
        }
        log.info("Scheduler time grid: {}", grid);
        return grid;
    }

    @Bean
    public Clock clock(TimeGrid timeGrid) {
        return Clock.system(timeGrid.getZone());
    }

    private static Set<DayOfWeek> parseDays(String raw) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String part : StringUtils.split(StringUtils.defaultString(raw), ", ")) {
            days.add(parseDay(part));
        }
        return days;
    }

    private static DayOfWeek parseDay(String raw) {
        return DayOfWeek.valueOf(StringUtils.trim(raw).toUpperCase(Locale.ROOT));
    }
}
