package at.sv.astro;

import at.sv.astro.solar.InvalidCoordinate;
import at.sv.astro.solar.NoSunriseOrSunset;
import at.sv.astro.solar.SolarNoonSolver;
import at.sv.astro.solar.SolarParameters;
import at.sv.astro.solar.SunEvent;
import at.sv.astro.solar.SunriseSunsetSolver;
import at.sv.astro.time.JulianDateConverter;
import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Computes sunrise, sunset and solar noon for a date and location, expressed in the zone of the given date.
 * <p>
 * All operations reject out of range coordinates with {@link InvalidCoordinate} before computing anything. Sunrise
 * and sunset fail with {@link NoSunriseOrSunset} during polar day or polar night.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
@Slf4j
public final class SunCalculator {

    private final JulianDateAnchor anchor;
    private final NextEventAdvance nextEventAdvance;

    public SunCalculator() {
        this(JulianDateAnchor.INSTANT, NextEventAdvance.FIXED_24_HOURS);
    }

    public SunCalculator(JulianDateAnchor anchor, NextEventAdvance nextEventAdvance) {
        this.anchor = Objects.requireNonNull(anchor, "anchor");
        this.nextEventAdvance = Objects.requireNonNull(nextEventAdvance, "nextEventAdvance");
    }

    public ZonedDateTime sunrise(ZonedDateTime dateTime, double latitude, double longitude) {
        return sunrise(dateTime, GeoCoordinate.of(latitude, longitude));
    }

    public ZonedDateTime sunrise(ZonedDateTime dateTime, GeoCoordinate location) {
        return event(SunEvent.SUNRISE, dateTime, location);
    }

    public ZonedDateTime sunset(ZonedDateTime dateTime, double latitude, double longitude) {
        return sunset(dateTime, GeoCoordinate.of(latitude, longitude));
    }

    public ZonedDateTime sunset(ZonedDateTime dateTime, GeoCoordinate location) {
        return event(SunEvent.SUNSET, dateTime, location);
    }

    /**
     * @return the first sunrise strictly after the given time
     */
    public ZonedDateTime nextSunrise(ZonedDateTime after, double latitude, double longitude) {
        return nextSunrise(after, GeoCoordinate.of(latitude, longitude));
    }

    public ZonedDateTime nextSunrise(ZonedDateTime after, GeoCoordinate location) {
        return nextEvent(SunEvent.SUNRISE, after, location);
    }

    /**
     * @return the first sunset strictly after the given time
     */
    public ZonedDateTime nextSunset(ZonedDateTime after, double latitude, double longitude) {
        return nextSunset(after, GeoCoordinate.of(latitude, longitude));
    }

    public ZonedDateTime nextSunset(ZonedDateTime after, GeoCoordinate location) {
        return nextEvent(SunEvent.SUNSET, after, location);
    }

    public ZonedDateTime solarNoon(ZonedDateTime dateTime, double latitude, double longitude) {
        return solarNoon(dateTime, GeoCoordinate.of(latitude, longitude));
    }

    /**
     * Solar noon is defined at every latitude, so unlike sunrise and sunset this never fails for valid coordinates.
     */
    public ZonedDateTime solarNoon(ZonedDateTime dateTime, GeoCoordinate location) {
        double julianCentury = JulianDateConverter.toJulianCentury(julianDate(dateTime));
        double minutesUtc = SolarNoonSolver.solarNoonUtc(julianCentury, location.longitude());
        return JulianDateConverter.fromUtcMinutes(dateTime.toLocalDate(), minutesUtc, dateTime.getZone());
    }

    public SolarParameters solarParameters(ZonedDateTime dateTime) {
        return SolarParameters.at(JulianDateConverter.toJulianCentury(julianDate(dateTime)));
    }

    private ZonedDateTime event(SunEvent event, ZonedDateTime dateTime, GeoCoordinate location) {
        double minutesUtc = SunriseSunsetSolver.solve(event, julianDate(dateTime), location.latitude(),
                location.longitude());
        ZonedDateTime result = JulianDateConverter.fromUtcMinutes(dateTime.toLocalDate(), minutesUtc,
                dateTime.getZone());
        log.debug("{} at {} on {}: {}", event, location, dateTime.toLocalDate(), result);
        return result;
    }

    private ZonedDateTime nextEvent(SunEvent event, ZonedDateTime after, GeoCoordinate location) {
        ZonedDateTime day = after;
        ZonedDateTime candidate = event(event, day, location);
        // a single advance suffices unless a clock change kept the advanced time on the same calendar date
        while (!after.isBefore(candidate)) {
            day = nextEventAdvance.advance(day);
            candidate = event(event, day, location);
        }
        return candidate;
    }

    private double julianDate(ZonedDateTime dateTime) {
        if (anchor == JulianDateAnchor.START_OF_DAY) {
            return JulianDateConverter.toJulianDate(dateTime.toLocalDate().atStartOfDay(), dateTime.getOffset());
        }
        return JulianDateConverter.toJulianDate(dateTime);
    }
}
