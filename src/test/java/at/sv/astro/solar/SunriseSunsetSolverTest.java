package at.sv.astro.solar;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SunriseSunsetSolverTest {

    // 2017-07-10T15:04:05Z
    private static final double JULIAN_DATE = 2457945.127835648;
    private static final double USHUAIA_LAT = -54.8019;
    private static final double USHUAIA_LON = -68.3030;

    @Test
    void sunrise_minutesAfterUtcMidnight() {
        assertThat(SunriseSunsetSolver.sunriseUtc(JULIAN_DATE, USHUAIA_LAT, USHUAIA_LON))
                .isCloseTo(771.605581695942, within(1e-7));
    }

    @Test
    void sunset_minutesAfterUtcMidnight() {
        assertThat(SunriseSunsetSolver.sunsetUtc(JULIAN_DATE, USHUAIA_LAT, USHUAIA_LON))
                .isCloseTo(1226.206594494752, within(1e-7));
    }

    @Test
    void solve_sameAsNamedEvents() {
        assertThat(SunriseSunsetSolver.solve(SunEvent.SUNRISE, JULIAN_DATE, USHUAIA_LAT, USHUAIA_LON))
                .isEqualTo(SunriseSunsetSolver.sunriseUtc(JULIAN_DATE, USHUAIA_LAT, USHUAIA_LON));
        assertThat(SunriseSunsetSolver.solve(SunEvent.SUNSET, JULIAN_DATE, USHUAIA_LAT, USHUAIA_LON))
                .isEqualTo(SunriseSunsetSolver.sunsetUtc(JULIAN_DATE, USHUAIA_LAT, USHUAIA_LON));
    }

    @Test
    void farEast_sunriseOnPreviousUtcDay_negativeMinutes() {
        // Melbourne
        assertThat(SunriseSunsetSolver.sunriseUtc(JULIAN_DATE, -37.8136, 144.9631)).isNegative();
    }

    @Test
    void farWest_sunsetOnNextUtcDay_exceedsFullDay() {
        // southern summer: 2017-12-29T15:04:05Z
        assertThat(SunriseSunsetSolver.sunsetUtc(2458117.127835648, USHUAIA_LAT, USHUAIA_LON)).isGreaterThan(1440);
    }

    @Test
    void northernSummer_aboveArcticCircle_polarDay() {
        assertThatThrownBy(() -> SunriseSunsetSolver.sunriseUtc(JULIAN_DATE, 70, 15))
                .isInstanceOf(NoSunriseOrSunset.class)
                .extracting(e -> ((NoSunriseOrSunset) e).getCondition())
                .isEqualTo(NoSunriseOrSunset.PolarCondition.POLAR_DAY);
        assertThatThrownBy(() -> SunriseSunsetSolver.sunsetUtc(JULIAN_DATE, -70, 15))
                .isInstanceOf(NoSunriseOrSunset.class)
                .extracting(e -> ((NoSunriseOrSunset) e).getCondition())
                .isEqualTo(NoSunriseOrSunset.PolarCondition.POLAR_NIGHT);
    }
}
