package io.github.jakubt4.astrolabe.model;

/**
 * Absolute instant expressed as a Julian Day number in Universal Time.
 *
 * <p>This is the only time representation handed to the ephemeris provider. Two birth moments
 * that denote the same UTC instant resolve to bit-identical values.
 *
 * @param julianDay fractional Julian Day (UT), e.g. {@code 2451545.0} for 2000-01-01 12:00 UTC
 */
public record UtInstant(double julianDay) {

    public static final UtInstant J2000 = new UtInstant(2451545.0);

    public UtInstant minusDays(final double days) {
        return new UtInstant(julianDay - days);
    }

    public UtInstant plusDays(final double days) {
        return new UtInstant(julianDay + days);
    }

    /**
     * Julian centuries elapsed since J2000.0, the time argument of the precession and
     * lunar node polynomials.
     */
    public double centuriesSinceJ2000() {
        return (julianDay - J2000.julianDay) / 36525.0;
    }
}
