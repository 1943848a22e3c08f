package at.sv.prayer.time;

/**
 * Signals a time zone identifier that is not known to the platform's time zone database.
 */
public final class InvalidTimeZoneException extends RuntimeException {

    public InvalidTimeZoneException(String message, Throwable cause) {
        super(message, cause);
    }
}
