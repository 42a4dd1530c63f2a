package at.sv.astro;

import java.time.ZonedDateTime;

public interface SunTimesProvider {

    ZonedDateTime getSunrise(ZonedDateTime dateTime);

    ZonedDateTime getNoon(ZonedDateTime dateTime);

    ZonedDateTime getSunset(ZonedDateTime dateTime);

    ZonedDateTime getNextSunrise(ZonedDateTime after);

    ZonedDateTime getNextSunset(ZonedDateTime after);

    String toDebugString(ZonedDateTime dateTime);
}
