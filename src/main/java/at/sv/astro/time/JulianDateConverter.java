package at.sv.astro.time;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Conversions between civil timestamps and the Julian date / Julian century axis used by the solar formulas.
 */
public final class JulianDateConverter {

    /**
     * Julian date of the J2000.0 epoch (2000-01-01 12:00 UT).
     */
    public static final double J2000 = 2451545.0;
    public static final double DAYS_PER_CENTURY = 36525.0;
    public static final double MINUTES_PER_DAY = 1440.0;

    private static final double SECONDS_PER_DAY = 86400.0;

    private JulianDateConverter() {
    }

    public static double toJulianDate(ZonedDateTime dateTime) {
        return toJulianDate(dateTime.toLocalDateTime(), dateTime.getOffset());
    }

    /**
     * Gregorian calendar date to Julian day number, plus the fraction of the day, shifted by the UTC offset.
     * Integer divisions truncate towards zero, which the day number formula relies on for January and February.
     */
    public static double toJulianDate(LocalDateTime dateTime, ZoneOffset offset) {
        int y = dateTime.getYear();
        int m = dateTime.getMonthValue();
        int d = dateTime.getDayOfMonth();

        int julianDay = (1461 * (y + 4800 + (m - 14) / 12)) / 4
                        + (367 * (m - 2 - 12 * ((m - 14) / 12))) / 12
                        - (3 * ((y + 4900 + (m - 14) / 12) / 100)) / 4
                        + d - 32075;

        int millis = dateTime.getNano() / 1_000_000;
        double julianDate = julianDay
                            + (dateTime.getHour() - 12.0) / 24.0
                            + dateTime.getMinute() / MINUTES_PER_DAY
                            + dateTime.getSecond() / SECONDS_PER_DAY
                            + millis / (SECONDS_PER_DAY * 1000.0);

        return julianDate + offset.getTotalSeconds() / SECONDS_PER_DAY;
    }

    public static double toJulianCentury(double julianDate) {
        return (julianDate - J2000) / DAYS_PER_CENTURY;
    }

    public static double fromJulianCentury(double julianCentury) {
        return julianCentury * DAYS_PER_CENTURY + J2000;
    }

    /**
     * Builds UTC midnight of the given date, adds the given minutes truncated to whole seconds, and expresses the
     * result in the target zone. Minutes below zero or above 1440 land on the previous or next UTC day.
     */
    public static ZonedDateTime fromUtcMinutes(LocalDate anchorDate, double minutesUtc, ZoneId zone) {
        long seconds = (long) Math.floor(minutesUtc * 60);
        return anchorDate.atStartOfDay(ZoneOffset.UTC)
                         .plusSeconds(seconds)
                         .withZoneSameInstant(zone);
    }
}
