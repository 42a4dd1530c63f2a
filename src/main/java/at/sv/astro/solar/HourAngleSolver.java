package at.sv.astro.solar;

public final class HourAngleSolver {

    /**
     * Zenith distance of the center of the solar disk at sunrise and sunset: 90° plus 34' of atmospheric
     * refraction plus 16' of solar radius.
     */
    static final double SUNRISE_ZENITH = 90.833;

    private HourAngleSolver() {
    }

    /**
     * Hour angle in radians at which the sun crosses the horizon: negative (before local noon) for sunrise,
     * positive (after local noon) for sunset.
     *
     * @throws NoSunriseOrSunset if the sun stays above or below the horizon for the whole day
     */
    public static double hourAngle(double latitude, double declination, SunEvent event) {
        double cosHourAngle = cosHourAngle(latitude, declination);
        if (Double.isNaN(cosHourAngle) || cosHourAngle > 1) {
            throw new NoSunriseOrSunset(NoSunriseOrSunset.PolarCondition.POLAR_NIGHT, latitude, declination);
        }
        if (cosHourAngle < -1) {
            throw new NoSunriseOrSunset(NoSunriseOrSunset.PolarCondition.POLAR_DAY, latitude, declination);
        }
        double hourAngle = Math.acos(cosHourAngle);
        return event == SunEvent.SUNRISE ? -hourAngle : hourAngle;
    }

    static double cosHourAngle(double latitude, double declination) {
        double lat = Math.toRadians(latitude);
        double dec = Math.toRadians(declination);
        return Math.cos(Math.toRadians(SUNRISE_ZENITH)) / (Math.cos(lat) * Math.cos(dec))
               - Math.tan(lat) * Math.tan(dec);
    }
}
