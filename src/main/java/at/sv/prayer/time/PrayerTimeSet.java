package at.sv.prayer.time;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The prayer times of one day at one location. All times share the location's zone; {@code midnight} usually falls
 * on the following calendar day.
 */
public record PrayerTimeSet(ZonedDateTime fajr, ZonedDateTime sunrise, ZonedDateTime dhuhr, ZonedDateTime asr,
                            ZonedDateTime sunset, ZonedDateTime maghrib, ZonedDateTime isha,
                            ZonedDateTime midnight) {

    public ZonedDateTime get(Prayer prayer) {
        return switch (prayer) {
            case FAJR -> fajr;
            case SUNRISE -> sunrise;
            case DHUHR -> dhuhr;
            case ASR -> asr;
            case SUNSET -> sunset;
            case MAGHRIB -> maghrib;
            case ISHA -> isha;
            case MIDNIGHT -> midnight;
        };
    }

    /**
     * @param pattern a {@link DateTimeFormatter} pattern, e.g. {@code HH:mm}
     * @return the formatted times keyed by display name, in chronological order
     */
    public Map<String, String> formatAll(String pattern) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern);
        Map<String, String> result = new LinkedHashMap<>();
        for (Prayer prayer : Prayer.values()) {
            result.put(prayer.getDisplayName(), formatter.format(get(prayer)));
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Prayer Times:");
        formatAll("HH:mm").forEach((name, time) -> sb.append('\n').append(String.format(Locale.ROOT, "%-9s %s", name + ":", time)));
        return sb.toString();
    }
}
