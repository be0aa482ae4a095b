package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.zodiac.ZodiacSign;

/**
 * A longitude decomposed into sign, whole degree, whole minute and decan.
 *
 * @param longitude ecliptic longitude in [0, 360)
 * @param sign      30° sign containing the longitude
 * @param degree    whole degrees within the sign, 0..29
 * @param minute    whole arc minutes within the degree, 0..59
 * @param decan     10° third of the sign, 1..3
 */
public record ZodiacPosition(double longitude, ZodiacSign sign, int degree, int minute, int decan) {
}
