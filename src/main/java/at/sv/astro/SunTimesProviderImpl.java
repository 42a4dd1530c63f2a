package at.sv.astro;

import at.sv.astro.solar.NoSunriseOrSunset;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Function;

/**
 * {@link SunTimesProvider} for a fixed location.
 */
public final class SunTimesProviderImpl implements SunTimesProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final GeoCoordinate location;
    private final SunCalculator calculator;

    public SunTimesProviderImpl(double lat, double lng) {
        this(GeoCoordinate.of(lat, lng), new SunCalculator());
    }

    public SunTimesProviderImpl(GeoCoordinate location, SunCalculator calculator) {
        this.location = location;
        this.calculator = calculator;
    }

    @Override
    public ZonedDateTime getSunrise(ZonedDateTime dateTime) {
        return calculator.sunrise(dateTime, location);
    }

    @Override
    public ZonedDateTime getNoon(ZonedDateTime dateTime) {
        return calculator.solarNoon(dateTime, location);
    }

    @Override
    public ZonedDateTime getSunset(ZonedDateTime dateTime) {
        return calculator.sunset(dateTime, location);
    }

    @Override
    public ZonedDateTime getNextSunrise(ZonedDateTime after) {
        return calculator.nextSunrise(after, location);
    }

    @Override
    public ZonedDateTime getNextSunset(ZonedDateTime after) {
        return calculator.nextSunset(after, location);
    }

    @Override
    public String toDebugString(ZonedDateTime dateTime) {
        return "location: " + location +
               "\nsunrise: " + format(this::getSunrise, dateTime) +
               "\nnoon: " + format(this::getNoon, dateTime) +
               "\nsunset: " + format(this::getSunset, dateTime) +
               "\n" + calculator.solarParameters(dateTime).toDebugString();
    }

    private static String format(Function<ZonedDateTime, ZonedDateTime> event, ZonedDateTime dateTime) {
        try {
            return TIME_FORMATTER.format(event.apply(dateTime));
        } catch (NoSunriseOrSunset e) {
            return "none (" + e.getCondition().getDescription() + ")";
        }
    }
}
