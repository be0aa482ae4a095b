package io.github.jakubt4.astrolabe.ephemeris;

/**
 * Geocentric ecliptic position of a body as returned by the provider.
 *
 * @param body           selector the position was computed for
 * @param longitude      ecliptic longitude in degrees, normalized to [0, 360)
 * @param latitude       ecliptic latitude in degrees
 * @param distance       distance from the Earth's centre in astronomical units
 * @param longitudeSpeed daily motion in longitude (deg/day), {@code 0} unless
 *                       {@link CalculationFlag#SPEED} was requested
 */
public record BodyPosition(EphemerisBody body,
                           double longitude,
                           double latitude,
                           double distance,
                           double longitudeSpeed) {
}
