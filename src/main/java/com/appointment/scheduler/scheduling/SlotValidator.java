package com.appointment.scheduler.scheduling;

import com.appointment.scheduler.exception.SchedulingException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Checks a requested start time against the grid and the reference "now".
 * The caller always supplies {@code now}.
 */
@Component
public class SlotValidator {

    private final TimeGrid timeGrid;

    public SlotValidator(TimeGrid timeGrid) {
        this.timeGrid = timeGrid;
    }

    public void validate(Instant startTime, Instant now) {
        if (!timeGrid.isAligned(startTime)) {
            throw SchedulingException.invalidSlot(String.format(
                    "Appointments must start on a %d-minute boundary between %s and %s, %s.",
                    timeGrid.getSlotLength().toMinutes(),
                    timeGrid.getOpen(),
                    timeGrid.getClose(),
                    StringUtils.join(timeGrid.getBusinessDays(), ", ")));
        }
        if (!startTime.isAfter(now)) {
            throw SchedulingException.pastBooking();
        }
    }
}
