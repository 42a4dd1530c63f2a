package at.sv.astro.solar;

/**
 * Position of the sun as a function of the Julian century, based on NOAA's solar calculator.
 * See: <a href="https://gml.noaa.gov/grad/solcalc/calcdetails.html">NOAA Solar Calculations</a>
 * <p>
 * All angles are in degrees; they are converted to radians only as arguments of trigonometric functions.
 */
public final class SolarEphemeris {

    private SolarEphemeris() {
    }

    /**
     * Geometric mean longitude of the sun, normalized to [0, 360).
     */
    public static double meanLongitude(double t) {
        double longitude = (280.46646 + t * (36000.76983 + 0.0003032 * t)) % 360;
        return longitude < 0 ? longitude + 360 : longitude;
    }

    /**
     * Geometric mean anomaly of the sun. Not normalized.
     */
    public static double meanAnomaly(double t) {
        return 357.52911 + t * (35999.05029 - 0.0001537 * t);
    }

    public static double eccentricity(double t) {
        return 0.016708634 - t * (0.000042037 + 0.0000001267 * t);
    }

    public static double equationOfCenter(double t) {
        double m = Math.toRadians(meanAnomaly(t));
        return Math.sin(m) * (1.914602 - t * (0.004817 + 0.000014 * t))
               + Math.sin(m + m) * (0.019993 - 0.000101 * t)
               + Math.sin(m + m + m) * 0.000289;
    }

    public static double trueLongitude(double t) {
        return meanLongitude(t) + equationOfCenter(t);
    }

    public static double apparentLongitude(double t) {
        return trueLongitude(t) - 0.00569 - 0.00478 * Math.sin(Math.toRadians(omega(t)));
    }

    /**
     * Mean obliquity of the ecliptic: 23° 26' plus a polynomial in arcseconds.
     */
    public static double meanObliquity(double t) {
        double seconds = 21.448 - t * (46.8150 + t * (0.00059 - t * 0.001813));
        return 23.0 + (26.0 + seconds / 60.0) / 60.0;
    }

    public static double obliquityCorrection(double t) {
        return meanObliquity(t) + 0.00256 * Math.cos(Math.toRadians(omega(t)));
    }

    public static double declination(double t) {
        double sinDeclination = Math.sin(Math.toRadians(obliquityCorrection(t)))
                                * Math.sin(Math.toRadians(apparentLongitude(t)));
        return Math.toDegrees(Math.asin(sinDeclination));
    }

    /**
     * Difference between apparent and mean solar time, in minutes.
     */
    public static double equationOfTime(double t) {
        double epsilon = obliquityCorrection(t);
        double l0 = Math.toRadians(meanLongitude(t));
        double e = eccentricity(t);
        double m = Math.toRadians(meanAnomaly(t));

        double y = Math.tan(Math.toRadians(epsilon) / 2.0);
        y *= y;

        double sin2l0 = Math.sin(2.0 * l0);
        double sinm = Math.sin(m);
        double cos2l0 = Math.cos(2.0 * l0);
        double sin4l0 = Math.sin(4.0 * l0);
        double sin2m = Math.sin(2.0 * m);

        double eqTime = y * sin2l0
                        - 2.0 * e * sinm
                        + 4.0 * e * y * sinm * cos2l0
                        - 0.5 * y * y * sin4l0
                        - 1.25 * e * e * sin2m;

        return Math.toDegrees(eqTime) * 4.0;
    }

    // longitude of the ascending node of the moon's orbit, drives nutation and aberration
    private static double omega(double t) {
        return 125.04 - 1934.136 * t;
    }
}
