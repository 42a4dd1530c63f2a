package at.sv.astro;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * How the next day is reached when today's event has already passed.
 */
public enum NextEventAdvance {
    /**
     * Adds an exact duration of 24 hours. Across a daylight saving transition this can skip a civil day.
     */
    FIXED_24_HOURS,
    /**
     * Adds one calendar day, keeping the local time of day where possible.
     */
    CALENDAR_DAY;

    public ZonedDateTime advance(ZonedDateTime dateTime) {
        if (this == CALENDAR_DAY) {
            return dateTime.plusDays(1);
        }
        return dateTime.plus(Duration.ofHours(24));
    }
}
