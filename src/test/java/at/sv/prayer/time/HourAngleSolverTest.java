package at.sv.prayer.time;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HourAngleSolverTest {

    private static final double SOLSTICE_DECLINATION = Math.toRadians(23.44);

    @Test
    void hourAngle_equatorAtEquinox_horizonIsReachedAfterSixHours() {
        assertThat(HourAngleSolver.hourAngle(0, 0, 0)).isCloseTo(Math.PI / 2, within(1e-12));
    }

    @Test
    void hourAngle_belowHorizon_isLargerThanAtHorizon() {
        double latitude = Math.toRadians(35.6892);

        double sunset = HourAngleSolver.hourAngle(-0.833, latitude, SOLSTICE_DECLINATION);
        double isha = HourAngleSolver.hourAngle(-14.0, latitude, SOLSTICE_DECLINATION);
        double fajr = HourAngleSolver.hourAngle(-17.7, latitude, SOLSTICE_DECLINATION);

        assertThat(Math.toDegrees(sunset)).isCloseTo(109.32, within(0.05));
        assertThat(isha).isGreaterThan(sunset);
        assertThat(fajr).isGreaterThan(isha);
    }

    @Test
    void hourAngle_midnightSun_clampsToPi() {
        double hourAngle = HourAngleSolver.hourAngle(-0.833, Math.toRadians(70), SOLSTICE_DECLINATION);

        assertThat(hourAngle).isEqualTo(Math.PI);
    }

    @Test
    void hourAngle_polarNight_clampsToZero() {
        double hourAngle = HourAngleSolver.hourAngle(-0.833, Math.toRadians(70), -SOLSTICE_DECLINATION);

        assertThat(hourAngle).isEqualTo(0.0);
    }

    @Test
    void hourAngle_twilightNeverEnds_clampsToPi() {
        double hourAngle = HourAngleSolver.hourAngle(-17.7, Math.toRadians(55), SOLSTICE_DECLINATION);

        assertThat(hourAngle).isEqualTo(Math.PI);
    }

    @Test
    void asrHourAngle_sunOverhead_shafiiIsFortyFiveDegrees() {
        assertThat(HourAngleSolver.asrHourAngle(CalculatorConfig.SHAFII_SHADOW_FACTOR, 0, 0))
                .isCloseTo(Math.PI / 4, within(1e-12));
    }

    @Test
    void asrHourAngle_sunOverhead_hanafi() {
        assertThat(Math.toDegrees(HourAngleSolver.asrHourAngle(CalculatorConfig.HANAFI_SHADOW_FACTOR, 0, 0)))
                .isCloseTo(63.4349488, within(1e-6));
    }

    @Test
    void asrHourAngle_usesDistanceBetweenLatitudeAndDeclination() {
        double north = HourAngleSolver.asrHourAngle(1.0, Math.toRadians(30), Math.toRadians(10));
        double south = HourAngleSolver.asrHourAngle(1.0, Math.toRadians(-30), Math.toRadians(-10));

        assertThat(north).isCloseTo(south, within(1e-12));
    }
}
