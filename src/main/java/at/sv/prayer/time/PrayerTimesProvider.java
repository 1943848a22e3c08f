package at.sv.prayer.time;

import java.time.LocalDate;
import java.time.ZonedDateTime;

public interface PrayerTimesProvider {

    PrayerTimeSet getPrayerTimes(LocalDate date);

    ZonedDateTime getFajr(ZonedDateTime dateTime);

    ZonedDateTime getSunrise(ZonedDateTime dateTime);

    ZonedDateTime getDhuhr(ZonedDateTime dateTime);

    ZonedDateTime getAsr(ZonedDateTime dateTime);

    ZonedDateTime getSunset(ZonedDateTime dateTime);

    ZonedDateTime getMaghrib(ZonedDateTime dateTime);

    ZonedDateTime getIsha(ZonedDateTime dateTime);

    ZonedDateTime getMidnight(ZonedDateTime dateTime);

    /**
     * @return one line per prayer of the local date of {@code dateTime}, for logging
     */
    String toDebugString(ZonedDateTime dateTime);

    void clearCache();
}
