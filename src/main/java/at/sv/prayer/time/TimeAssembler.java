package at.sv.prayer.time;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Turns the solar parameters of a day into local prayer times. All intermediate values are minutes after UTC
 * midnight of the respective date.
 */
final class TimeAssembler {

    private static final double MINUTES_PER_DEGREE = 4.0;

    private final CalculatorConfig config;

    TimeAssembler(CalculatorConfig config) {
        this.config = config;
    }

    /**
     * @param today    the solar parameters of {@code date}
     * @param tomorrow the solar parameters of the following date, only needed for midnight
     */
    PrayerTimeSet assemble(LocalDate date, Location location, SolarParameters today, SolarParameters tomorrow) {
        ZoneId zone = location.zoneId();
        double latitude = Math.toRadians(location.latitude());
        double solarNoon = solarNoon(location.longitude(), today);

        double sunHourAngle = hourAngleMinutes(
                HourAngleSolver.hourAngle(config.getSunriseSunsetAltitude(), latitude, today.declination()));
        ZonedDateTime sunrise = toZonedDateTime(date, solarNoon - sunHourAngle, zone);
        ZonedDateTime sunset = toZonedDateTime(date, solarNoon + sunHourAngle, zone);

        ZonedDateTime fajr = toZonedDateTime(date, fajrMinutes(solarNoon, latitude, today), zone);
        double ishaHourAngle = hourAngleMinutes(
                HourAngleSolver.hourAngle(-config.getIshaAngle(), latitude, today.declination()));
        ZonedDateTime isha = toZonedDateTime(date, solarNoon + ishaHourAngle, zone);

        ZonedDateTime dhuhr = toZonedDateTime(date, solarNoon, zone);

        double asrHourAngle = hourAngleMinutes(
                HourAngleSolver.asrHourAngle(config.getAsrShadowFactor(), latitude, today.declination()));
        ZonedDateTime asr = toZonedDateTime(date, solarNoon + asrHourAngle, zone);

        ZonedDateTime maghrib = sunset.plusMinutes(config.getMaghribOffsetMinutes());

        LocalDate nextDate = date.plusDays(1);
        double nextSolarNoon = solarNoon(location.longitude(), tomorrow);
        ZonedDateTime nextFajr = toZonedDateTime(nextDate, fajrMinutes(nextSolarNoon, latitude, tomorrow), zone);
        ZonedDateTime midnight = sunset.plus(halfOf(Duration.between(sunset, nextFajr)));

        return new PrayerTimeSet(fajr, sunrise, dhuhr, asr, sunset, maghrib, isha, midnight);
    }

    private double fajrMinutes(double solarNoon, double latitude, SolarParameters parameters) {
        return solarNoon - hourAngleMinutes(
                HourAngleSolver.hourAngle(-config.getFajrAngle(), latitude, parameters.declination()));
    }

    static double solarNoon(double longitude, SolarParameters parameters) {
        return 720.0 - MINUTES_PER_DEGREE * longitude - parameters.equationOfTimeMinutes();
    }

    private static double hourAngleMinutes(double hourAngle) {
        return MINUTES_PER_DEGREE * Math.toDegrees(hourAngle);
    }

    /**
     * Floors to whole seconds.
     */
    private static Duration halfOf(Duration duration) {
        return Duration.ofSeconds(Math.floorDiv(duration.getSeconds(), 2));
    }

    /**
     * Converts minutes after UTC midnight into a local date-time. The offset in effect at wall-clock 00:00 of
     * {@code date} is used to round the local time half up to the second; if a transition skips 00:00, that is the
     * offset before the gap. The resulting instant does not depend on the offset apart from rounding.
     */
    static ZonedDateTime toZonedDateTime(LocalDate date, double utcMinutes, ZoneId zone) {
        ZoneOffset midnightOffset = zone.getRules().getOffset(date.atStartOfDay());
        long offsetMinutes = midnightOffset.getTotalSeconds() / 60;
        long localSeconds = roundHalfUp((utcMinutes + offsetMinutes) * 60.0);
        Instant utcMidnight = date.atStartOfDay(ZoneOffset.UTC).toInstant();
        return ZonedDateTime.ofInstant(utcMidnight.plusSeconds(localSeconds - offsetMinutes * 60L), zone);
    }

    static long roundHalfUp(double seconds) {
        return (long) Math.floor(seconds + 0.5);
    }
}
