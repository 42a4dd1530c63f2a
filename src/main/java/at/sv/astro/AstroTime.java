package at.sv.astro;

import at.sv.astro.solar.NoSunriseOrSunset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Function;

@Command(name = "AstroTime", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints sunrise, solar noon and sunset for a location, based on NOAA's solar calculator.")
public final class AstroTime implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(AstroTime.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180], east positive.")
    double longitude;
    @Option(names = "--date", paramLabel = "<yyyy-MM-dd>",
            description = "The date to compute the sun times for. Default: today")
    LocalDate date;
    @Option(names = "--zone", paramLabel = "<zone>",
            description = "The time zone the results are printed in, e.g. Europe/Vienna. Default: system time zone")
    ZoneId zone;
    @Option(names = "--after", paramLabel = "<yyyy-MM-ddTHH:mm>",
            description = "If set, prints the next sunrise and sunset strictly after the given local date time " +
                          "instead of the sun times of --date.")
    LocalDateTime after;
    @Option(names = "--anchor",
            defaultValue = "${env:ANCHOR:-INSTANT}",
            description = "Which point of the given date time the solar position is sampled at. " +
                          "Valid values: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    JulianDateAnchor anchor;
    @Option(names = "--next-event-advance",
            defaultValue = "${env:NEXT_EVENT_ADVANCE:-FIXED_24_HOURS}",
            description = "How the following day is reached if the event has already passed. " +
                          "Valid values: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    NextEventAdvance nextEventAdvance;
    @Option(names = "--debug",
            description = "Additionally print the solar ephemeris values.")
    boolean debug;

    private static final DateTimeFormatter OUTPUT_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    public static void main(String[] args) {
        int execute = new CommandLine(new AstroTime()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        assertGeographicConfigurations();
        GeoCoordinate location = GeoCoordinate.of(latitude, longitude);
        SunTimesProvider provider = createSunTimesProvider(location);
        MDC.put("context", location.toString());
        try {
            if (after != null) {
                printNextEvents(provider, after.atZone(getZone()));
            } else {
                printEvents(provider, getDate().atStartOfDay(getZone()));
            }
        } finally {
            MDC.remove("context");
        }
    }

    SunTimesProvider createSunTimesProvider(GeoCoordinate location) {
        return new SunTimesProviderImpl(location, new SunCalculator(anchor, nextEventAdvance));
    }

    private void printEvents(SunTimesProvider provider, ZonedDateTime dateTime) {
        PrintWriter out = spec.commandLine().getOut();
        out.println("sunrise: " + format(provider::getSunrise, dateTime));
        out.println("noon: " + format(provider::getNoon, dateTime));
        out.println("sunset: " + format(provider::getSunset, dateTime));
        if (debug) {
            out.println(provider.toDebugString(dateTime));
        }
        out.flush();
    }

    private void printNextEvents(SunTimesProvider provider, ZonedDateTime dateTime) {
        PrintWriter out = spec.commandLine().getOut();
        out.println("next_sunrise: " + format(provider::getNextSunrise, dateTime));
        out.println("next_sunset: " + format(provider::getNextSunset, dateTime));
        if (debug) {
            out.println(provider.toDebugString(dateTime));
        }
        out.flush();
    }

    private String format(Function<ZonedDateTime, ZonedDateTime> event, ZonedDateTime dateTime) {
        try {
            return OUTPUT_FORMATTER.format(event.apply(dateTime));
        } catch (NoSunriseOrSunset e) {
            LOG.warn("{}", e.getMessage());
            return "none";
        }
    }

    private LocalDate getDate() {
        if (date == null) {
            return LocalDate.now(getZone());
        }
        return date;
    }

    private ZoneId getZone() {
        if (zone == null) {
            return ZoneId.systemDefault();
        }
        return zone;
    }

    private void assertGeographicConfigurations() {
        if (!Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
