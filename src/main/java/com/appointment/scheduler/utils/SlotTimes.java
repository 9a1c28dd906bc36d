package com.appointment.scheduler.utils;

import com.appointment.scheduler.exception.SchedulingException;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;

/**
 * ISO-8601 conversion for timestamps crossing the API boundary.
 */
public final class SlotTimes {

    private SlotTimes() {
    }

    /**
     * Parses an ISO-8601 date-time. A value without offset is read in {@code zone}.
     * Sub-second parts are kept so that grid validation can reject them.
     */
    public static Instant parse(String raw, ZoneId zone) {
        if (StringUtils.isBlank(raw)) {
            throw SchedulingException.invalidRequest("start_time is required.");
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(raw.trim(), ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw SchedulingException.invalidRequest(
                    "Invalid datetime format. Use ISO 8601 (e.g. 2024-01-01T13:30:00Z).");
        }
    }

    public static String format(Instant instant, ZoneId zone) {
        if (instant == null) return null;
        return instant.truncatedTo(ChronoUnit.SECONDS)
                .atZone(zone)
                .toOffsetDateTime()
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    public static String formatDate(Instant instant, ZoneId zone) {
        LocalDate date = instant.atZone(zone).toLocalDate();
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }
}
