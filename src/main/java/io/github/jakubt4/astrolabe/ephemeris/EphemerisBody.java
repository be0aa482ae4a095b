package io.github.jakubt4.astrolabe.ephemeris;

import java.util.List;

/**
 * Body selector accepted by {@link EphemerisProvider#calcBody}.
 */
public enum EphemerisBody {
    SUN,
    MOON,
    MERCURY,
    VENUS,
    MARS,
    JUPITER,
    SATURN,
    URANUS,
    NEPTUNE,
    PLUTO,
    MEAN_NODE,
    TRUE_NODE;

    /** The ten bodies Sun through Pluto, in traditional order. */
    public static final List<EphemerisBody> PLANETS = List.of(
            SUN, MOON, MERCURY, VENUS, MARS, JUPITER, SATURN, URANUS, NEPTUNE, PLUTO);
}
