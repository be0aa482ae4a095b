package io.github.jakubt4.astrolabe.ephemeris;

import io.github.jakubt4.astrolabe.model.UtInstant;

/**
 * Sidereal correction methods (ayanamsas).
 *
 * <p>Each method fixes the correction angle at a reference epoch; the angle at any other
 * instant follows from the IAU 2006 general precession in longitude accumulated since that
 * epoch. Reference values are the published Swiss Ephemeris constants for each method.
 */
public enum SiderealMethod {
    FAGAN_BRADLEY("Fagan/Bradley", 2433282.42346, 24.042044444),
    LAHIRI("Lahiri", 2435553.5, 23.250182778 - 0.004658035),
    RAMAN("Raman", 2415020.0, 360.0 - 338.98556),
    KRISHNAMURTI("Krishnamurti", 2415020.0, 360.0 - 337.636111);

    private static final double ARCSEC_PER_DEGREE = 3600.0;

    private final String displayName;
    private final double referenceJulianDay;
    private final double angleAtReference;

    SiderealMethod(final String displayName, final double referenceJulianDay, final double angleAtReference) {
        this.displayName = displayName;
        this.referenceJulianDay = referenceJulianDay;
        this.angleAtReference = angleAtReference;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Correction angle in degrees at the given instant.
     */
    public double correctionAngle(final UtInstant instant) {
        final var reference = new UtInstant(referenceJulianDay);
        final var accumulated = generalPrecession(instant.centuriesSinceJ2000())
                - generalPrecession(reference.centuriesSinceJ2000());
        return angleAtReference + accumulated / ARCSEC_PER_DEGREE;
    }

    /**
     * General precession in longitude p<sub>A</sub> (IAU 2006, Capitaine et al. 2003), arcseconds.
     */
    static double generalPrecession(final double t) {
        return t * (5028.796195 + t * (1.1054348 + t * (0.00007964 + t * (-0.000023857 + t * -0.0000000383))));
    }
}
