package io.github.jakubt4.astrolabe.ephemeris;

import java.util.Objects;

/**
 * Coordinate mode of an {@link EphemerisProvider}: tropical, or sidereal with a given
 * correction method.
 *
 * @param sidereal whether longitudes requested with {@link CalculationFlag#SIDEREAL} are allowed
 * @param method   correction method, {@code null} in tropical mode
 */
public record CoordinateMode(boolean sidereal, SiderealMethod method) {

    public static final CoordinateMode TROPICAL = new CoordinateMode(false, null);

    public CoordinateMode {
        if (sidereal) {
            Objects.requireNonNull(method, "sidereal mode requires a correction method");
        }
    }

    public static CoordinateMode sidereal(final SiderealMethod method) {
        return new CoordinateMode(true, method);
    }
}
