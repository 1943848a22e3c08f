package at.sv.prayer.time;

import lombok.Builder;
import lombok.Data;

/**
 * The angles and offsets that define the prayer times. Instances are immutable, the defaults are the conventions
 * used in Iran.
 * <p>
 * Angles must be finite, the Asr shadow factor finite and positive, and the Maghrib offset not negative; the
 * constructor (and therefore the builder) throws {@link IllegalArgumentException} otherwise.
 */
@Data
@Builder(toBuilder = true)
public final class CalculatorConfig {

    public static final double SHAFII_SHADOW_FACTOR = 1.0;
    public static final double HANAFI_SHADOW_FACTOR = 2.0;

    public static final CalculatorConfig DEFAULT = CalculatorConfig.builder().build();

    /**
     * Depression of the sun below the horizon at dawn, in degrees.
     */
    @Builder.Default
    private final double fajrAngle = 17.7;
    /**
     * Depression of the sun below the horizon at nightfall, in degrees.
     */
    @Builder.Default
    private final double ishaAngle = 14.0;
    /**
     * Altitude of the sun's center at sunrise and sunset, accounting for refraction and the solar disk.
     */
    @Builder.Default
    private final double sunriseSunsetAltitude = -0.833;
    @Builder.Default
    private final double asrShadowFactor = SHAFII_SHADOW_FACTOR;
    @Builder.Default
    private final long maghribOffsetMinutes = 21;

    public CalculatorConfig(double fajrAngle, double ishaAngle, double sunriseSunsetAltitude, double asrShadowFactor,
                            long maghribOffsetMinutes) {
        assertFinite("Fajr angle", fajrAngle);
        assertFinite("Isha angle", ishaAngle);
        assertFinite("Sunrise/sunset altitude", sunriseSunsetAltitude);
        assertFinite("Asr shadow factor", asrShadowFactor);
        if (asrShadowFactor <= 0) {
            throw new IllegalArgumentException("Asr shadow factor must be > 0, but was " + asrShadowFactor);
        }
        if (maghribOffsetMinutes < 0) {
            throw new IllegalArgumentException("Maghrib offset must be >= 0, but was " + maghribOffsetMinutes);
        }
        this.fajrAngle = fajrAngle;
        this.ishaAngle = ishaAngle;
        this.sunriseSunsetAltitude = sunriseSunsetAltitude;
        this.asrShadowFactor = asrShadowFactor;
        this.maghribOffsetMinutes = maghribOffsetMinutes;
    }

    private static void assertFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be a finite number, but was " + value);
        }
    }
}
