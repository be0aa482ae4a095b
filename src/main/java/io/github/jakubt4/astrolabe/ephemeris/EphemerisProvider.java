package io.github.jakubt4.astrolabe.ephemeris;

import io.github.jakubt4.astrolabe.model.UtInstant;

import java.util.Set;

/**
 * Raw astronomical data source: body longitudes, house frames and the sidereal correction.
 *
 * <p>Implementations keep a coordinate mode as mutable instance state, mirroring the global
 * sidereal switch of classic ephemeris libraries. An instance is therefore never shared between
 * concurrent computations: {@link EphemerisProviderFactory} hands out one per computation, and
 * {@link EphemerisSession} re-asserts the mode before every call.
 */
public interface EphemerisProvider {

    /**
     * Day number of a calendar date and fractional UT hour.
     */
    double julianDay(int year, int month, int day, double hour, CalendarType calendar);

    /**
     * Ecliptic position of a body.
     *
     * @throws ProviderCalculationException if the body cannot be computed for this instant
     */
    BodyPosition calcBody(UtInstant instant, EphemerisBody body, Set<CalculationFlag> flags);

    /**
     * Ascendant, midheaven and twelve cusps for an observer.
     *
     * @throws ProviderCalculationException if the house frame cannot be computed
     */
    HouseCusps calcHouses(UtInstant instant, double latitude, double longitude,
                          HouseSystem system, Set<CalculationFlag> flags);

    void setCoordinateMode(CoordinateMode mode);

    CoordinateMode getCoordinateMode();

    /**
     * Sidereal correction angle, in degrees, of the active sidereal method at the given instant.
     *
     * @throws ProviderCalculationException if no sidereal method is active
     */
    double getCorrectionAngle(UtInstant instant);

    /**
     * Replaces the search path of ephemeris data files. Implementations may refuse when the
     * data is shared with other providers.
     */
    void setDataPath(String path);
}
