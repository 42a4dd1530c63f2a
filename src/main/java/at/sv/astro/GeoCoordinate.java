package at.sv.astro;

import at.sv.astro.solar.InvalidCoordinate;

import java.util.Locale;

/**
 * A position on earth in decimal degrees. Positive latitudes are north, positive longitudes are east.
 * Latitudes outside [-90, 90] and longitudes outside [-180, 180] are rejected with {@link InvalidCoordinate}.
 */
public record GeoCoordinate(double latitude, double longitude) {

    public GeoCoordinate {
        if (!Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
            throw new InvalidCoordinate("Latitude must be between -90 and 90 degrees, got: " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            throw new InvalidCoordinate("Longitude must be between -180 and 180 degrees, got: " + longitude);
        }
    }

    public static GeoCoordinate of(double latitude, double longitude) {
        return new GeoCoordinate(latitude, longitude);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.4f,%.4f", latitude, longitude);
    }
}
