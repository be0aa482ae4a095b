package io.github.jakubt4.astrolabe.derived;

import io.github.jakubt4.astrolabe.model.UtInstant;
import io.github.jakubt4.astrolabe.zodiac.GateWheel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tropical longitudes of every {@link ActivationPoint} at one instant.
 */
public record LongitudeSnapshot(UtInstant instant, Map<ActivationPoint, Double> longitudes) {

    public LongitudeSnapshot {
        longitudes = Collections.unmodifiableMap(new EnumMap<>(longitudes));
    }

    public double longitude(final ActivationPoint point) {
        final var value = longitudes.get(point);
        if (value == null) {
            throw new IllegalArgumentException("No longitude for " + point);
        }
        return value;
    }

    public GateWheel.Activation activation(final ActivationPoint point) {
        return GateWheel.activation(longitude(point));
    }
}
