package io.github.jakubt4.astrolabe.ephemeris;

/**
 * Computation flags for {@link EphemerisProvider} calls.
 */
public enum CalculationFlag {
    /** Also compute the daily motion in longitude. */
    SPEED,
    /** Return longitudes in the sidereal frame of the active {@link CoordinateMode}. */
    SIDEREAL
}
