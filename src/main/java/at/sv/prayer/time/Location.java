package at.sv.prayer.time;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * A point on earth together with the time zone its prayer times are expressed in.
 *
 * @param latitude   degrees in [-90, 90], positive north
 * @param longitude  degrees in [-180, 180], positive east
 * @param timeZoneId an IANA time zone identifier, e.g. {@code Asia/Tehran}
 */
public record Location(double latitude, double longitude, String timeZoneId) {

    public Location {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new InvalidLocationException("Latitude must be between -90 and 90 degrees, but was " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new InvalidLocationException("Longitude must be between -180 and 180 degrees, but was " + longitude);
        }
        if (timeZoneId == null || timeZoneId.isBlank()) {
            throw new InvalidTimeZoneException("Missing time zone identifier", null);
        }
    }

    /**
     * @throws InvalidTimeZoneException if the identifier cannot be resolved
     */
    public ZoneId zoneId() {
        try {
            return ZoneId.of(timeZoneId);
        } catch (DateTimeException e) {
            throw new InvalidTimeZoneException("Unknown time zone '" + timeZoneId + "': " + e.getMessage(), e);
        }
    }
}
