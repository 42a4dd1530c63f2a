package at.sv.astro.solar;

import java.util.Locale;

/**
 * Snapshot of all solar ephemeris values at one Julian century. Angles in degrees, equation of time in minutes.
 */
public record SolarParameters(double julianCentury,
                              double meanLongitude,
                              double meanAnomaly,
                              double eccentricity,
                              double equationOfCenter,
                              double trueLongitude,
                              double apparentLongitude,
                              double obliquityCorrection,
                              double declination,
                              double equationOfTime) {

    public static SolarParameters at(double julianCentury) {
        return new SolarParameters(
                julianCentury,
                SolarEphemeris.meanLongitude(julianCentury),
                SolarEphemeris.meanAnomaly(julianCentury),
                SolarEphemeris.eccentricity(julianCentury),
                SolarEphemeris.equationOfCenter(julianCentury),
                SolarEphemeris.trueLongitude(julianCentury),
                SolarEphemeris.apparentLongitude(julianCentury),
                SolarEphemeris.obliquityCorrection(julianCentury),
                SolarEphemeris.declination(julianCentury),
                SolarEphemeris.equationOfTime(julianCentury));
    }

    public String toDebugString() {
        return String.format(Locale.ROOT,
                "julian_century: %.9f" +
                "\nmean_longitude: %.6f" +
                "\nmean_anomaly: %.6f" +
                "\neccentricity: %.9f" +
                "\nequation_of_center: %.6f" +
                "\ntrue_longitude: %.6f" +
                "\napparent_longitude: %.6f" +
                "\nobliquity_correction: %.6f" +
                "\ndeclination: %.6f" +
                "\nequation_of_time: %.4f min",
                julianCentury, meanLongitude, meanAnomaly, eccentricity, equationOfCenter, trueLongitude,
                apparentLongitude, obliquityCorrection, declination, equationOfTime);
    }
}
