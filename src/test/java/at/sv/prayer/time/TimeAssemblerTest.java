package at.sv.prayer.time;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class TimeAssemblerTest {

    private static final LocalDate DATE = LocalDate.of(2024, 1, 15);

    private static ZonedDateTime convert(double utcMinutes, ZoneId zone) {
        return TimeAssembler.toZonedDateTime(DATE, utcMinutes, zone);
    }

    @Test
    void toZonedDateTime_appliesOffsetOfLocalMidnight() {
        ZonedDateTime time = convert(90.0, ZoneId.of("Asia/Tehran"));

        assertThat(time.toLocalDateTime()).isEqualTo(LocalDateTime.of(2024, 1, 15, 5, 0));
        assertThat(time.toInstant()).isEqualTo(Instant.parse("2024-01-15T01:30:00Z"));
    }

    @Test
    void toZonedDateTime_roundsHalfUp_notHalfEven() {
        assertThat(convert(0.375, ZoneOffset.UTC).toLocalTime().getSecond()).isEqualTo(23); // 22.5 s
        assertThat(convert(0.125, ZoneOffset.UTC).toLocalTime().getSecond()).isEqualTo(8); // 7.5 s
        assertThat(convert(0.12, ZoneOffset.UTC).toLocalTime().getSecond()).isEqualTo(7); // 7.2 s
    }

    @Test
    void toZonedDateTime_negativeMinutes_fallOnPreviousDay() {
        ZonedDateTime time = convert(-30.0, ZoneOffset.UTC);

        assertThat(time.toLocalDateTime()).isEqualTo(LocalDateTime.of(2024, 1, 14, 23, 30));
    }

    @Test
    void toZonedDateTime_isMonotonicInItsInput() {
        ZoneId zone = ZoneId.of("Europe/Vienna");
        ZonedDateTime previous = convert(-60.0, zone);
        for (double minutes = -60.0; minutes < 1500.0; minutes += 0.0137) {
            ZonedDateTime current = convert(minutes, zone);

            assertThat(current).as("At %s minutes", minutes).isAfterOrEqualTo(previous);
            previous = current;
        }
    }

    @Test
    void toZonedDateTime_dstChangeDuringDay_keepsUtcInstant() {
        ZonedDateTime time = TimeAssembler.toZonedDateTime(LocalDate.of(2024, 3, 31), 720.0, ZoneId.of("Europe/Vienna"));

        assertThat(time.toInstant()).isEqualTo(Instant.parse("2024-03-31T12:00:00Z"));
        assertThat(time.getHour()).isEqualTo(14);
    }

    @Test
    void toZonedDateTime_dstSkipsLocalMidnight_keepsUtcInstant() {
        // Iran moved from 00:00 +03:30 straight to 01:00 +04:30 on 2022-03-22
        LocalDate date = LocalDate.of(2022, 3, 22);
        ZoneId tehran = ZoneId.of("Asia/Tehran");

        ZonedDateTime start = TimeAssembler.toZonedDateTime(date, 0.0, tehran);
        ZonedDateTime noon = TimeAssembler.toZonedDateTime(date, 500.0, tehran);

        assertThat(start.toInstant()).isEqualTo(Instant.parse("2022-03-22T00:00:00Z"));
        assertThat(noon.toInstant()).isEqualTo(Instant.parse("2022-03-22T08:20:00Z"));
        assertThat(noon.toLocalDateTime()).isEqualTo(LocalDateTime.of(2022, 3, 22, 12, 50));
    }

    @Test
    void roundHalfUp_boundaries() {
        assertThat(TimeAssembler.roundHalfUp(0.5)).isEqualTo(1L);
        assertThat(TimeAssembler.roundHalfUp(1.4999)).isEqualTo(1L);
        assertThat(TimeAssembler.roundHalfUp(-0.5)).isEqualTo(0L);
        assertThat(TimeAssembler.roundHalfUp(-0.6)).isEqualTo(-1L);
    }

    @Test
    void solarNoon_greenwichWithoutEquationOfTime_isTwelveUtc() {
        assertThat(TimeAssembler.solarNoon(0.0, new SolarParameters(0.0, 0.0))).isEqualTo(720.0);
        assertThat(TimeAssembler.solarNoon(15.0, new SolarParameters(0.0, 2.0))).isEqualTo(658.0);
    }

    @Test
    void assemble_maghribAndMidnight_derivedFromSunset() {
        CalculatorConfig config = CalculatorConfig.builder().maghribOffsetMinutes(19).build();
        TimeAssembler assembler = new TimeAssembler(config);
        SolarParameters equinox = new SolarParameters(0.0, 0.0);

        PrayerTimeSet times = assembler.assemble(DATE, new Location(0.0, 0.0, "UTC"), equinox, equinox);

        assertThat(times.dhuhr().toLocalTime()).hasToString("12:00");
        assertThat(times.maghrib()).isEqualTo(times.sunset().plusMinutes(19));
        assertThat(times.midnight().toLocalDate()).isEqualTo(DATE);
        assertThat(times.midnight()).isEqualTo(times.sunset().plusSeconds(
                (times.fajr().plusDays(1).toEpochSecond() - times.sunset().toEpochSecond()) / 2));
    }
}
