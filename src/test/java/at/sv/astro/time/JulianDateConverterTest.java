package at.sv.astro.time;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class JulianDateConverterTest {

    private static final LocalDate DATE = LocalDate.of(2017, 7, 10);

    private static void assertJulianDate(LocalDateTime dateTime, ZoneOffset offset, double expected) {
        assertThat(JulianDateConverter.toJulianDate(dateTime, offset)).isCloseTo(expected, within(1e-9));
    }

    private static void assertFromUtcMinutes(double minutes, String expected) {
        assertThat(JulianDateConverter.fromUtcMinutes(DATE, minutes, ZoneOffset.UTC))
                .isEqualTo(ZonedDateTime.parse(expected));
    }

    @Test
    void toJulianDate_j2000Epoch() {
        assertThat(JulianDateConverter.toJulianDate(LocalDateTime.of(2000, 1, 1, 12, 0), ZoneOffset.UTC))
                .isEqualTo(JulianDateConverter.J2000);
    }

    @Test
    void toJulianDate_midnight_endsWithHalfDay() {
        assertJulianDate(LocalDateTime.of(2020, 2, 29, 0, 0), ZoneOffset.UTC, 2458908.5);
        assertJulianDate(LocalDateTime.of(1582, 10, 15, 0, 0), ZoneOffset.UTC, 2299160.5);
    }

    @Test
    void toJulianDate_includesSecondsAndMillis() {
        assertJulianDate(LocalDateTime.of(2017, 7, 10, 15, 4, 5, 250_000_000), ZoneOffset.UTC, 2457945.1278385418);
    }

    @Test
    void toJulianDate_addsUtcOffset() {
        assertJulianDate(LocalDateTime.of(2000, 1, 1, 12, 0), ZoneOffset.ofHours(1), 2451545.0416666665);
        assertJulianDate(LocalDateTime.of(2017, 12, 15, 10, 14), ZoneOffset.ofHours(-5), 2458102.718055555);
    }

    @Test
    void toJulianDate_zonedDateTime_usesOffsetOfInstant() {
        ZonedDateTime dateTime = ZonedDateTime.of(2017, 12, 15, 10, 14, 0, 0, ZoneId.of("America/New_York"));

        assertThat(JulianDateConverter.toJulianDate(dateTime)).isCloseTo(2458102.718055555, within(1e-9));
    }

    @Test
    void julianCentury_roundTrip() {
        double century = JulianDateConverter.toJulianCentury(2457945.1278385418);

        assertThat(JulianDateConverter.toJulianCentury(JulianDateConverter.J2000)).isZero();
        assertThat(century).isCloseTo(0.1752259504, within(1e-9));
        assertThat(JulianDateConverter.fromJulianCentury(century)).isCloseTo(2457945.1278385418, within(1e-6));
    }

    @Test
    void fromUtcMinutes_truncatesToWholeSeconds() {
        assertFromUtcMinutes(90.5, "2017-07-10T01:30:30Z");
        assertFromUtcMinutes(90.999, "2017-07-10T01:30:59Z");
        assertFromUtcMinutes(0, "2017-07-10T00:00:00Z");
    }

    @Test
    void fromUtcMinutes_outsideOfDay_movesToAdjacentUtcDay() {
        assertFromUtcMinutes(-30.25, "2017-07-09T23:29:45Z");
        assertFromUtcMinutes(1450, "2017-07-11T00:10:00Z");
    }

    @Test
    void fromUtcMinutes_expressedInTargetZone() {
        ZonedDateTime result = JulianDateConverter.fromUtcMinutes(DATE, 720, ZoneId.of("Australia/Melbourne"));

        assertThat(result.getZone()).isEqualTo(ZoneId.of("Australia/Melbourne"));
        assertThat(result.toLocalDateTime()).isEqualTo(LocalDateTime.of(2017, 7, 10, 22, 0));
    }
}
