package at.sv.prayer.time;

/**
 * Position of the sun for one Julian Day.
 *
 * @param declination           solar declination in radians
 * @param equationOfTimeMinutes apparent minus mean solar time, in signed minutes
 */
public record SolarParameters(double declination, double equationOfTimeMinutes) {
}
