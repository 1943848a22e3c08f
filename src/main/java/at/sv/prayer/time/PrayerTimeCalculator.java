package at.sv.prayer.time;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;

/**
 * Calculates prayer times from the position of the sun: Julian day, solar declination and equation of time,
 * hour angles for the defining altitudes, and finally local time.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
@Slf4j
public final class PrayerTimeCalculator {

    @Getter
    private final CalculatorConfig config;
    private final TimeAssembler assembler;

    public PrayerTimeCalculator() {
        this(CalculatorConfig.DEFAULT);
    }

    public PrayerTimeCalculator(CalculatorConfig config) {
        assertConfiguration(config);
        this.config = config;
        this.assembler = new TimeAssembler(config);
    }

    /**
     * @param date       the local date to calculate the times for
     * @param latitude   in degrees, positive for north
     * @param longitude  in degrees, positive for east
     * @param timeZoneId IANA time zone identifier, e.g. {@code Asia/Tehran}
     * @throws InvalidTimeZoneException if the time zone is not known
     * @throws InvalidLocationException if the coordinates are out of range
     */
    public PrayerTimeSet calculate(LocalDate date, double latitude, double longitude, String timeZoneId) {
        return calculate(date, new Location(latitude, longitude, timeZoneId));
    }

    public PrayerTimeSet calculate(LocalDate date, Location location) {
        SolarParameters today = solarParametersFor(date);
        SolarParameters tomorrow = solarParametersFor(date.plusDays(1));
        PrayerTimeSet times = assembler.assemble(date, location, today, tomorrow);
        if (log.isDebugEnabled()) {
            log.debug("Calculated {} at {}: {}", date, location, times.formatAll("HH:mm:ss"));
        }
        return times;
    }

    private static SolarParameters solarParametersFor(LocalDate date) {
        return SolarEphemeris.solarParameters(JulianDayConverter.toJulianDay(date));
    }

    private static void assertConfiguration(CalculatorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Missing calculator config");
        }
    }
}
