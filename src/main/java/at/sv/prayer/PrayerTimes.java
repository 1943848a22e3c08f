package at.sv.prayer;

import at.sv.prayer.time.PrayerTimeCalculator;
import at.sv.prayer.time.PrayerTimeSet;
import at.sv.prayer.time.PrayerTimesProviderImpl;

import java.time.LocalDate;

/**
 * Shortcuts for the common cases: a known city, or plain coordinates.
 */
public final class PrayerTimes {

    public static final String DEFAULT_TIME_ZONE = "Asia/Tehran";

    private PrayerTimes() {
    }

    public static PrayerTimesProviderImpl forCity(City city) {
        return forCity(city, new PrayerTimeCalculator());
    }

    public static PrayerTimesProviderImpl forCity(City city, PrayerTimeCalculator calculator) {
        return new PrayerTimesProviderImpl(city.toLocation(), calculator);
    }

    public static PrayerTimeSet calculateForCoordinates(LocalDate date, double latitude, double longitude) {
        return calculateForCoordinates(date, latitude, longitude, DEFAULT_TIME_ZONE);
    }

    public static PrayerTimeSet calculateForCoordinates(LocalDate date, double latitude, double longitude,
                                                        String timeZoneId) {
        return calculateForCoordinates(date, latitude, longitude, timeZoneId, new PrayerTimeCalculator());
    }

    public static PrayerTimeSet calculateForCoordinates(LocalDate date, double latitude, double longitude,
                                                        String timeZoneId, PrayerTimeCalculator calculator) {
        return calculator.calculate(date, latitude, longitude, timeZoneId);
    }
}
