package at.sv.prayer;

import at.sv.prayer.time.CalculatorConfig;
import at.sv.prayer.time.InvalidLocationException;
import at.sv.prayer.time.InvalidTimeZoneException;
import at.sv.prayer.time.Location;
import at.sv.prayer.time.PrayerTimeCalculator;
import at.sv.prayer.time.PrayerTimesProviderImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

@Command(name = "prayer-times", version = "1.0.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints the Islamic prayer times of a location, calculated from the position of the sun.")
public final class PrayerTimesCli implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(PrayerTimesCli.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--city",
            defaultValue = "${env:CITY}",
            description = "A predefined city, used instead of --lat, --long and --time-zone. " +
                          "Valid values: ${COMPLETION-CANDIDATES}")
    City city;
    @Option(names = "--lat",
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    Double latitude;
    @Option(names = "--long",
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180].")
    Double longitude;
    @Option(names = "--time-zone", paramLabel = "<zone>",
            defaultValue = "${env:TIME_ZONE:-Asia/Tehran}",
            description = "The IANA time zone of your location. Default: ${DEFAULT-VALUE}")
    String timeZone;
    @Option(names = "--date", paramLabel = "<yyyy-MM-dd>",
            defaultValue = "${env:DATE}",
            description = "The first date to calculate. Default: today in the location's time zone.")
    String dateString;
    @Option(names = "--days", paramLabel = "<days>",
            defaultValue = "${env:DAYS:-1}",
            description = "The number of consecutive days to print [1..366]. Default: ${DEFAULT-VALUE}")
    int days;
    @Option(names = "--fajr-angle", paramLabel = "<degrees>",
            defaultValue = "${env:FAJR_ANGLE:-17.7}",
            description = "The depression of the sun below the horizon at dawn. Default: ${DEFAULT-VALUE}")
    double fajrAngle;
    @Option(names = "--isha-angle", paramLabel = "<degrees>",
            defaultValue = "${env:ISHA_ANGLE:-14.0}",
            description = "The depression of the sun below the horizon at nightfall. Default: ${DEFAULT-VALUE}")
    double ishaAngle;
    @Option(names = "--sunrise-sunset-altitude", paramLabel = "<degrees>",
            defaultValue = "${env:SUNRISE_SUNSET_ALTITUDE:--0.833}",
            description = "The altitude of the sun's center at sunrise and sunset. Default: ${DEFAULT-VALUE}")
    double sunriseSunsetAltitude;
    @Option(names = "--asr-shadow-factor", paramLabel = "<factor>",
            defaultValue = "${env:ASR_SHADOW_FACTOR:-1.0}",
            description = "The shadow length ratio for Asr: 1 for Shafii, 2 for Hanafi. Default: ${DEFAULT-VALUE}")
    double asrShadowFactor;
    @Option(names = "--hanafi",
            defaultValue = "${env:HANAFI:-false}",
            description = "Shortcut for --asr-shadow-factor 2. Default: ${DEFAULT-VALUE}")
    boolean hanafi;
    @Option(names = "--maghrib-offset", paramLabel = "<minutes>",
            defaultValue = "${env:MAGHRIB_OFFSET:-21}",
            description = "The minutes between sunset and Maghrib. Default: ${DEFAULT-VALUE}")
    long maghribOffsetMinutes;
    @Option(names = "--pattern",
            defaultValue = "${env:PATTERN:-HH:mm}",
            description = "The format of the printed times. Default: ${DEFAULT-VALUE}")
    String pattern;

    public static void main(String[] args) {
        int execute = new CommandLine(new PrayerTimesCli()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        Location location = createLocation();
        PrayerTimeCalculator calculator = new PrayerTimeCalculator(createConfig());
        PrayerTimesProviderImpl provider = new PrayerTimesProviderImpl(location, calculator);
        LocalDate start = parseDate(location);
        LOG.info("Calculating {} day(s) from {} for {} with {}", days, start, describe(location), calculator.getConfig());
        MDC.put("context", "calc");
        try {
            print(provider, start);
        } finally {
            MDC.remove("context");
        }
    }

    private void print(PrayerTimesProviderImpl provider, LocalDate start) {
        PrintWriter out = spec != null ? spec.commandLine().getOut() : new PrintWriter(System.out, true);
        if (days == 1) {
            out.println("Prayer times for " + describe(provider.getLocation()) + " on " + start + ":");
            out.println(FormatUtil.formatDay(provider.getPrayerTimes(start), pattern));
        } else {
            out.println(FormatUtil.formatHeader());
            for (int i = 0; i < days; i++) {
                LocalDate date = start.plusDays(i);
                out.println(FormatUtil.formatRow(date, provider.getPrayerTimes(date), pattern));
            }
        }
        out.flush();
    }

    private String describe(Location location) {
        if (city != null) {
            return city.getDisplayName() + " (" + city.getPersianName() + ")";
        }
        return location.latitude() + ", " + location.longitude() + " [" + location.timeZoneId() + "]";
    }

    private Location createLocation() {
        if (city != null) {
            return city.toLocation();
        }
        try {
            Location location = new Location(latitude, longitude, timeZone);
            location.zoneId();
            return location;
        } catch (InvalidLocationException | InvalidTimeZoneException e) {
            fail(e.getMessage());
            return null;
        }
    }

    private CalculatorConfig createConfig() {
        try {
            return CalculatorConfig.builder()
                                   .fajrAngle(fajrAngle)
                                   .ishaAngle(ishaAngle)
                                   .sunriseSunsetAltitude(sunriseSunsetAltitude)
                                   .asrShadowFactor(hanafi ? CalculatorConfig.HANAFI_SHADOW_FACTOR : asrShadowFactor)
                                   .maghribOffsetMinutes(maghribOffsetMinutes)
                                   .build();
        } catch (IllegalArgumentException e) {
            fail(e.getMessage());
            return null;
        }
    }

    private LocalDate parseDate(Location location) {
        if (dateString == null || dateString.isBlank()) {
            return LocalDate.now(location.zoneId());
        }
        try {
            return LocalDate.parse(dateString.trim());
        } catch (DateTimeParseException e) {
            fail("--date must be an ISO date like 2024-06-21, but was '" + dateString + "'");
            return null;
        }
    }

    private void assertConfigurationParameters() {
        assertGeographicConfigurations();
        assertCalculationConfigurations();
        assertOutputConfigurations();
    }

    private void assertGeographicConfigurations() {
        if (city != null) {
            return;
        }
        if (latitude == null || longitude == null) {
            fail("Either --city or both --lat and --long are required");
        }
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
    }

    private void assertCalculationConfigurations() {
        if (asrShadowFactor <= 0) {
            fail("--asr-shadow-factor must be > 0");
        }
        if (maghribOffsetMinutes < 0) {
            fail("--maghrib-offset must be >= 0");
        }
    }

    private void assertOutputConfigurations() {
        if (days < 1 || days > 366) {
            fail("--days must be between 1 and 366");
        }
        try {
            DateTimeFormatter.ofPattern(pattern);
        } catch (IllegalArgumentException e) {
            fail("--pattern is not a valid time pattern: " + e.getMessage());
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
