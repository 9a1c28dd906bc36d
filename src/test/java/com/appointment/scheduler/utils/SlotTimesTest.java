package com.appointment.scheduler.utils;

import com.appointment.scheduler.exception.ErrorKind;
import com.appointment.scheduler.exception.SchedulingException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SlotTimesTest {

    private final ZoneId berlin = ZoneId.of("Europe/Berlin");

    @Test
    void parse_shouldHonourExplicitOffset() {
        assertThat(SlotTimes.parse("2025-11-11T09:00:00Z", berlin)).isEqualTo(Instant.parse("2025-11-11T09:00:00Z"));
        assertThat(SlotTimes.parse("2025-11-11T09:00:00-05:00", berlin))
                .isEqualTo(Instant.parse("2025-11-11T14:00:00Z"));
    }

    @Test
    void parse_shouldReadLocalTimeInReferenceZone() {
        assertThat(SlotTimes.parse("2025-11-11T09:00:00", berlin)).isEqualTo(Instant.parse("2025-11-11T08:00:00Z"));
    }

    @Test
    void parse_shouldRejectGarbage() {
        assertThat(assertThrows(SchedulingException.class, () -> SlotTimes.parse("tomorrow", berlin)).getKind())
                .isEqualTo(ErrorKind.INVALID_REQUEST);
        assertThat(assertThrows(SchedulingException.class, () -> SlotTimes.parse(" ", berlin)).getKind())
                .isEqualTo(ErrorKind.INVALID_REQUEST);
    }

    @Test
    void format_shouldTruncateToSeconds() {
        Instant t = Instant.parse("2025-11-11T09:00:00.750Z");

        assertThat(SlotTimes.format(t, ZoneOffset.UTC)).isEqualTo("2025-11-11T09:00:00Z");
        assertThat(SlotTimes.format(t, berlin)).isEqualTo("2025-11-11T10:00:00+01:00");
        assertThat(SlotTimes.formatDate(Instant.parse("2025-11-16T23:30:00Z"), berlin)).isEqualTo("2025-11-17");
    }
}
