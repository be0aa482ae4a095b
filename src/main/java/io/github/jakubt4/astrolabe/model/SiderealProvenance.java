package io.github.jakubt4.astrolabe.model;

/**
 * How the sidereal house frame of a placement was obtained.
 */
public enum SiderealProvenance {
    /** Computed by the ephemeris provider in sidereal mode. */
    EPHEMERIS,
    /** Provider's sidereal house call failed; tropical frame minus the correction angle. */
    TROPICAL_MINUS_CORRECTION
}
