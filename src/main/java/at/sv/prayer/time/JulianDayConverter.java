package at.sv.prayer.time;

import java.time.LocalDate;

public final class JulianDayConverter {

    private JulianDayConverter() {
    }

    /**
     * Converts a proleptic Gregorian date to its Julian Day, counted from noon. Midnight at the start of the given
     * date therefore ends in {@code .5}.
     */
    public static double toJulianDay(LocalDate date) {
        int year = date.getYear();
        int month = date.getMonthValue();
        int day = date.getDayOfMonth();

        if (month <= 2) {
            year -= 1;
            month += 12;
        }

        int century = Math.floorDiv(year, 100);
        int correction = 2 - century + Math.floorDiv(century, 4);

        return Math.floor(365.25 * (year + 4716))
               + Math.floor(30.6001 * (month + 1))
               + day + correction - 1524.5;
    }
}
