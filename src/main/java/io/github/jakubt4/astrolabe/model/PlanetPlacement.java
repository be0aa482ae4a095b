package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.ephemeris.EphemerisBody;
import io.github.jakubt4.astrolabe.zodiac.ZodiacSign;

/**
 * Tropical placement of one of the ten bodies.
 *
 * @param longitudeSpeed daily motion in longitude, deg/day
 * @param retrograde     {@code true} when the daily motion is negative
 * @param house          house of the tropical frame, 1..12
 */
public record PlanetPlacement(EphemerisBody body,
                              double longitude,
                              double longitudeSpeed,
                              boolean retrograde,
                              ZodiacSign sign,
                              int degree,
                              int minute,
                              int house) {
}
