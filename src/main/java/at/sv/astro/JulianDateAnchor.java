package at.sv.astro;

/**
 * Which point of the input timestamp the Julian date, and thereby the sampled solar position, is computed from.
 */
public enum JulianDateAnchor {
    /**
     * The full timestamp including its time of day, as NOAA's spreadsheet samples it. Results shift by
     * up to about a minute depending on the time of day of the input.
     */
    INSTANT,
    /**
     * Midnight of the timestamp's calendar date in the timestamp's offset. Results depend on the date and offset only.
     */
    START_OF_DAY
}
