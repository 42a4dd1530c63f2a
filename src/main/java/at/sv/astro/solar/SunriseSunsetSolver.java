package at.sv.astro.solar;

import lombok.extern.slf4j.Slf4j;

import static at.sv.astro.time.JulianDateConverter.MINUTES_PER_DAY;
import static at.sv.astro.time.JulianDateConverter.fromJulianCentury;
import static at.sv.astro.time.JulianDateConverter.toJulianCentury;

/**
 * Sunrise and sunset in minutes after UTC midnight. Results below 0 or above 1440 belong to the previous or next
 * UTC day.
 */
@Slf4j
public final class SunriseSunsetSolver {

    private SunriseSunsetSolver() {
    }

    public static double sunriseUtc(double julianDate, double latitude, double longitude) {
        return solve(SunEvent.SUNRISE, julianDate, latitude, longitude);
    }

    public static double sunsetUtc(double julianDate, double latitude, double longitude) {
        return solve(SunEvent.SUNSET, julianDate, latitude, longitude);
    }

    /**
     * @throws NoSunriseOrSunset if the sun does not cross the horizon in either of the two passes
     */
    public static double solve(SunEvent event, double julianDate, double latitude, double longitude) {
        double t = toJulianCentury(julianDate);

        // sample the declination at local solar noon instead of the start of the Julian day
        double noonMinutes = SolarNoonSolver.solarNoonUtc(t, longitude);
        double noonCentury = toJulianCentury(julianDate + noonMinutes / MINUTES_PER_DAY);
        double approximate = eventUtc(event, noonCentury, latitude, longitude);

        double refinedCentury = toJulianCentury(fromJulianCentury(t) + approximate / MINUTES_PER_DAY);
        double refined = eventUtc(event, refinedCentury, latitude, longitude);

        log.trace("{} at {},{}: noon={} pass1={} pass2={}", event, latitude, longitude, noonMinutes, approximate,
                refined);
        return refined;
    }

    private static double eventUtc(SunEvent event, double julianCentury, double latitude, double longitude) {
        double equationOfTime = SolarEphemeris.equationOfTime(julianCentury);
        double declination = SolarEphemeris.declination(julianCentury);
        double hourAngle = HourAngleSolver.hourAngle(latitude, declination, event);

        double delta = Math.toDegrees(hourAngle) - longitude;
        return 720 + 4 * delta - equationOfTime;
    }
}
