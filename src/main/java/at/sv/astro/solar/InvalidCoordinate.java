package at.sv.astro.solar;

/**
 * Exception to signal a latitude or longitude outside of its valid range. Thrown before any computation is done.
 */
public final class InvalidCoordinate extends RuntimeException {
    public InvalidCoordinate(String message) {
        super(message);
    }
}
