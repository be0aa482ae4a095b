package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.zodiac.Longitudes;

/**
 * Sidereal lunar node and its counterpart 180° away.
 */
public record NodePair(double rahuLongitude, double ketuLongitude) {

    public static NodePair of(final double rahuLongitude) {
        final var rahu = Longitudes.normalize(rahuLongitude);
        return new NodePair(rahu, Longitudes.opposite(rahu));
    }
}
