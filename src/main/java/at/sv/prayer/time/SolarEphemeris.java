package at.sv.prayer.time;

/**
 * Low precision solar position, good to about one minute of time for civil use.
 */
public final class SolarEphemeris {

    static final double J2000 = 2451545.0;

    private SolarEphemeris() {
    }

    public static SolarParameters solarParameters(double julianDay) {
        double d = julianDay - J2000;

        double meanAnomaly = Math.toRadians(357.529 + 0.98560028 * d);
        double meanLongitude = 280.459 + 0.98564736 * d;
        double eclipticLongitude = Math.toRadians(modulo(
                meanLongitude + 1.915 * Math.sin(meanAnomaly) + 0.020 * Math.sin(2 * meanAnomaly), 360));
        double obliquity = Math.toRadians(23.439 - 0.00000036 * d);

        double rightAscension = modulo(Math.toDegrees(
                Math.atan2(Math.cos(obliquity) * Math.sin(eclipticLongitude), Math.cos(eclipticLongitude))), 360);
        double declination = Math.asin(Math.sin(obliquity) * Math.sin(eclipticLongitude));

        double delta = modulo(meanLongitude, 360) - rightAscension;
        if (delta > 180) {
            delta -= 360;
        } else if (delta < -180) {
            delta += 360;
        }
        return new SolarParameters(declination, 4.0 * delta);
    }

    /**
     * Floored modulo: the result carries the sign of the divisor, so angles always land in [0, divisor).
     */
    static double modulo(double dividend, double divisor) {
        return dividend - divisor * Math.floor(dividend / divisor);
    }
}
