package at.sv.prayer.time;

import lombok.extern.slf4j.Slf4j;

/**
 * Solves the hour angle at which the sun reaches a given altitude.
 * <p>
 * Where the sun never reaches the requested altitude on that day (polar day or night), the cosine of the hour angle
 * falls outside [-1, 1]. It is clamped to the nearest boundary, which yields 0 (sun never gets that high) or
 * {@code PI} (sun never gets that low). This is an approximation and not an astronomically correct answer for
 * high latitudes.
 */
@Slf4j
public final class HourAngleSolver {

    private HourAngleSolver() {
    }

    /**
     * @param altitudeDegrees the target altitude in degrees, negative below the horizon
     * @param latitude        geographic latitude in radians
     * @param declination     solar declination in radians
     * @return the hour angle in radians, within [0, PI]
     */
    public static double hourAngle(double altitudeDegrees, double latitude, double declination) {
        return hourAngleForAltitude(Math.toRadians(altitudeDegrees), latitude, declination);
    }

    /**
     * Hour angle of the afternoon prayer: the moment an object's shadow equals its noon shadow plus
     * {@code shadowFactor} times its height.
     *
     * @param shadowFactor 1 for the Shafii convention, 2 for the Hanafi one
     */
    public static double asrHourAngle(double shadowFactor, double latitude, double declination) {
        double altitude = Math.atan(1.0 / (shadowFactor + Math.tan(Math.abs(latitude - declination))));
        return hourAngleForAltitude(altitude, latitude, declination);
    }

    private static double hourAngleForAltitude(double altitude, double latitude, double declination) {
        double cosHourAngle = (Math.sin(altitude) - Math.sin(latitude) * Math.sin(declination))
                              / (Math.cos(latitude) * Math.cos(declination));
        if (cosHourAngle >= 1.0) {
            logClamped(cosHourAngle, altitude, latitude);
            return 0.0;
        }
        if (cosHourAngle <= -1.0) {
            logClamped(cosHourAngle, altitude, latitude);
            return Math.PI;
        }
        return Math.acos(cosHourAngle);
    }

    private static void logClamped(double cosHourAngle, double altitude, double latitude) {
        if (log.isTraceEnabled()) {
            log.trace("Clamped hour angle cosine {} for altitude {}° at latitude {}°", cosHourAngle,
                    Math.toDegrees(altitude), Math.toDegrees(latitude));
        }
    }
}
