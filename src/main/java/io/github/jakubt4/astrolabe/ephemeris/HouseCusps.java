package io.github.jakubt4.astrolabe.ephemeris;

import java.util.Arrays;
import java.util.List;

/**
 * Ascendant, midheaven and the twelve house cusps of a house frame.
 *
 * <p>Cusps are stored in a 13-slot array: slot 0 is unused so that {@code cusp(h)} addresses
 * house {@code h} directly.
 *
 * @param ascendant ecliptic longitude of the ascendant, degrees
 * @param mc        ecliptic longitude of the midheaven, degrees
 * @param cusps     13-slot cusp array, slot 0 unused
 */
public record HouseCusps(double ascendant, double mc, double[] cusps) {

    public static final int SLOTS = 13;

    public HouseCusps {
        if (cusps == null || cusps.length != SLOTS) {
            throw new IllegalArgumentException("House cusps must be a 13-slot array (slot 0 unused)");
        }
        cusps = cusps.clone();
    }

    public double cusp(final int house) {
        if (house < 1 || house > 12) {
            throw new IllegalArgumentException("House must be 1..12, got " + house);
        }
        return cusps[house];
    }

    @Override
    public double[] cusps() {
        return cusps.clone();
    }

    /** Cusps of houses 1..12 in order. */
    public List<Double> toList() {
        return Arrays.stream(cusps, 1, SLOTS).boxed().toList();
    }
}
