package at.sv.astro.solar;

import lombok.Getter;

import java.util.Locale;

/**
 * Exception to signal that the sun does not cross the horizon on the requested day at the requested latitude,
 * i.e. it either stays above it the whole day (polar day) or below it (polar night).
 */
@Getter
public final class NoSunriseOrSunset extends RuntimeException {

    private final PolarCondition condition;
    private final double latitude;
    private final double declination;

    public NoSunriseOrSunset(PolarCondition condition, double latitude, double declination) {
        super(String.format(Locale.ROOT, "No sunrise or sunset at latitude %.4f (solar declination %.4f): %s",
                latitude, declination, condition.getDescription()));
        this.condition = condition;
        this.latitude = latitude;
        this.declination = declination;
    }

    @Getter
    public enum PolarCondition {
        POLAR_DAY("the sun never sets"),
        POLAR_NIGHT("the sun never rises");

        private final String description;

        PolarCondition(String description) {
            this.description = description;
        }
    }
}
