package io.github.jakubt4.astrolabe.ephemeris;

import io.github.jakubt4.astrolabe.model.UtInstant;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-computation view of a provider that asserts the coordinate mode immediately before every
 * call, so no tropical call can inherit a sidereal correction and vice versa.
 */
public final class EphemerisSession {

    private static final Set<CalculationFlag> TROPICAL_FLAGS = EnumSet.of(CalculationFlag.SPEED);
    private static final Set<CalculationFlag> SIDEREAL_FLAGS =
            EnumSet.of(CalculationFlag.SPEED, CalculationFlag.SIDEREAL);

    private final EphemerisProvider provider;
    private final CoordinateMode siderealMode;

    public EphemerisSession(final EphemerisProvider provider, final SiderealMethod siderealMethod) {
        this.provider = provider;
        this.siderealMode = CoordinateMode.sidereal(siderealMethod);
    }

    public SiderealMethod siderealMethod() {
        return siderealMode.method();
    }

    public double julianDay(final int year, final int month, final int day, final double hour) {
        return provider.julianDay(year, month, day, hour, CalendarType.GREGORIAN);
    }

    public BodyPosition tropical(final UtInstant instant, final EphemerisBody body) {
        provider.setCoordinateMode(CoordinateMode.TROPICAL);
        return provider.calcBody(instant, body, TROPICAL_FLAGS);
    }

    public HouseCusps tropicalHouses(final UtInstant instant, final double latitude, final double longitude,
                                     final HouseSystem system) {
        provider.setCoordinateMode(CoordinateMode.TROPICAL);
        return provider.calcHouses(instant, latitude, longitude, system, TROPICAL_FLAGS);
    }

    public BodyPosition sidereal(final UtInstant instant, final EphemerisBody body) {
        provider.setCoordinateMode(siderealMode);
        return provider.calcBody(instant, body, SIDEREAL_FLAGS);
    }

    public HouseCusps siderealHouses(final UtInstant instant, final double latitude, final double longitude,
                                     final HouseSystem system) {
        provider.setCoordinateMode(siderealMode);
        return provider.calcHouses(instant, latitude, longitude, system, SIDEREAL_FLAGS);
    }

    public double correctionAngle(final UtInstant instant) {
        provider.setCoordinateMode(siderealMode);
        return provider.getCorrectionAngle(instant);
    }
}
