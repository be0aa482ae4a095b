package io.github.jakubt4.astrolabe.model;

/**
 * Complete placement of a birth moment. Computed fresh per request, never mutated and never
 * cached.
 *
 * @param sidereal {@code null} when the provider could not compute the sidereal frame
 */
public record PlacementAggregate(BirthMoment birthMoment,
                                 UtInstant instant,
                                 TropicalBlock tropical,
                                 SiderealBlock sidereal) {
}
