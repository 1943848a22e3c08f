package at.sv.prayer;

import at.sv.prayer.time.Prayer;
import at.sv.prayer.time.PrayerTimeSet;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

public final class FormatUtil {
    private FormatUtil() {
    }

    /**
     * One line per prayer, names padded so the times line up.
     */
    public static String formatDay(PrayerTimeSet times, String pattern) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : times.formatAll(pattern).entrySet()) {
            if (sb.length() > 0) {
                sb.append(System.lineSeparator());
            }
            sb.append(String.format(Locale.ROOT, "%-9s %s", entry.getKey() + ":", entry.getValue()));
        }
        return sb.toString();
    }

    public static String formatHeader() {
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT, "%-10s", "Date"));
        for (Prayer prayer : Prayer.values()) {
            sb.append(String.format(Locale.ROOT, " %-9s", prayer.getDisplayName()));
        }
        return sb.toString().stripTrailing();
    }

    /**
     * A single row of a multi-day table, matching {@link #formatHeader()}.
     */
    public static String formatRow(LocalDate date, PrayerTimeSet times, String pattern) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern);
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT, "%-10s", date));
        for (Prayer prayer : Prayer.values()) {
            sb.append(String.format(Locale.ROOT, " %-9s", formatter.format(times.get(prayer))));
        }
        return sb.toString().stripTrailing();
    }
}
