package at.sv.astro.solar;

import static at.sv.astro.time.JulianDateConverter.MINUTES_PER_DAY;
import static at.sv.astro.time.JulianDateConverter.fromJulianCentury;
import static at.sv.astro.time.JulianDateConverter.toJulianCentury;

public final class SolarNoonSolver {

    private SolarNoonSolver() {
    }

    /**
     * UTC time of solar noon, in minutes after UTC midnight, at the given longitude (degrees, east positive).
     * The first pass evaluates the equation of time at the nominal noon of the longitude, the second pass at the
     * noon found by the first one.
     */
    public static double solarNoonUtc(double julianCentury, double longitude) {
        double nominalNoon = toJulianCentury(fromJulianCentury(julianCentury) - longitude / 360.0);
        double approximateNoon = noonUtc(nominalNoon, longitude);

        double refinedNoon = toJulianCentury(fromJulianCentury(julianCentury) - 0.5 + approximateNoon / MINUTES_PER_DAY);
        return noonUtc(refinedNoon, longitude);
    }

    private static double noonUtc(double julianCentury, double longitude) {
        return 720 - (longitude * 4) - SolarEphemeris.equationOfTime(julianCentury);
    }
}
