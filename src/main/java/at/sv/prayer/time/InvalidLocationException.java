package at.sv.prayer.time;

/**
 * Signals a latitude outside [-90, 90] or a longitude outside [-180, 180] degrees, or a coordinate that is not a
 * number.
 */
public final class InvalidLocationException extends RuntimeException {

    public InvalidLocationException(String message) {
        super(message);
    }
}
