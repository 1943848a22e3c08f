package at.sv.prayer.time;

import lombok.Getter;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prayer times for a fixed location. The date of a requested date-time is taken in the location's zone; the time of
 * day is ignored.
 */
public final class PrayerTimesProviderImpl implements PrayerTimesProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    @Getter
    private final Location location;
    private final ZoneId zone;
    private final PrayerTimeCalculator calculator;

    private final Map<LocalDate, PrayerTimeSet> cache;

    public PrayerTimesProviderImpl(Location location, PrayerTimeCalculator calculator) {
        this.location = location;
        this.zone = location.zoneId();
        this.calculator = calculator;
        cache = new ConcurrentHashMap<>();
    }

    @Override
    public PrayerTimeSet getPrayerTimes(LocalDate date) {
        return cache.computeIfAbsent(date, d -> calculator.calculate(d, location));
    }

    /**
     * @return today's prayer times in the location's zone
     */
    public PrayerTimeSet getToday() {
        return getPrayerTimes(LocalDate.now(zone));
    }

    @Override
    public ZonedDateTime getFajr(ZonedDateTime dateTime) {
        return timesFor(dateTime).fajr();
    }

    @Override
    public ZonedDateTime getSunrise(ZonedDateTime dateTime) {
        return timesFor(dateTime).sunrise();
    }

    @Override
    public ZonedDateTime getDhuhr(ZonedDateTime dateTime) {
        return timesFor(dateTime).dhuhr();
    }

    @Override
    public ZonedDateTime getAsr(ZonedDateTime dateTime) {
        return timesFor(dateTime).asr();
    }

    @Override
    public ZonedDateTime getSunset(ZonedDateTime dateTime) {
        return timesFor(dateTime).sunset();
    }

    @Override
    public ZonedDateTime getMaghrib(ZonedDateTime dateTime) {
        return timesFor(dateTime).maghrib();
    }

    @Override
    public ZonedDateTime getIsha(ZonedDateTime dateTime) {
        return timesFor(dateTime).isha();
    }

    @Override
    public ZonedDateTime getMidnight(ZonedDateTime dateTime) {
        return timesFor(dateTime).midnight();
    }

    private PrayerTimeSet timesFor(ZonedDateTime dateTime) {
        return getPrayerTimes(dateTime.withZoneSameInstant(zone).toLocalDate());
    }

    @Override
    public String toDebugString(ZonedDateTime dateTime) {
        PrayerTimeSet times = timesFor(dateTime);
        StringBuilder sb = new StringBuilder();
        for (Prayer prayer : Prayer.values()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(prayer.name().toLowerCase(Locale.ENGLISH)).append(": ").append(format(times.get(prayer)));
        }
        return sb.toString();
    }

    @Override
    public void clearCache() {
        cache.clear();
    }

    private String format(ZonedDateTime time) {
        return TIME_FORMATTER.format(time);
    }
}
