package io.github.jakubt4.astrolabe.derived;

import io.github.jakubt4.astrolabe.ephemeris.EphemerisBody;

/**
 * Points read into a {@link LongitudeSnapshot}: the ten bodies, the mean lunar node and the two
 * points derived from them by opposition.
 */
public enum ActivationPoint {
    SUN(EphemerisBody.SUN),
    EARTH(null),
    MOON(EphemerisBody.MOON),
    NORTH_NODE(EphemerisBody.MEAN_NODE),
    SOUTH_NODE(null),
    MERCURY(EphemerisBody.MERCURY),
    VENUS(EphemerisBody.VENUS),
    MARS(EphemerisBody.MARS),
    JUPITER(EphemerisBody.JUPITER),
    SATURN(EphemerisBody.SATURN),
    URANUS(EphemerisBody.URANUS),
    NEPTUNE(EphemerisBody.NEPTUNE),
    PLUTO(EphemerisBody.PLUTO);

    private final EphemerisBody body;

    ActivationPoint(final EphemerisBody body) {
        this.body = body;
    }

    /**
     * Body queried from the provider, or {@code null} for EARTH and SOUTH_NODE, which sit
     * opposite the Sun and the north node.
     */
    public EphemerisBody body() {
        return body;
    }
}
