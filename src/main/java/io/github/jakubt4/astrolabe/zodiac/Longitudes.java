package io.github.jakubt4.astrolabe.zodiac;

import io.github.jakubt4.astrolabe.model.ZodiacPosition;

import java.util.OptionalInt;

/**
 * Boundary arithmetic shared by every zodiac subdivision: signs, decans, houses and lunar
 * sectors. All functions accept any finite longitude and normalize it first.
 */
public final class Longitudes {

    public static final double FULL_CIRCLE = 360.0;
    public static final double SIGN_SPAN = 30.0;
    public static final double DECAN_SPAN = 10.0;
    public static final int NAKSHATRA_COUNT = 27;
    public static final double NAKSHATRA_SPAN = FULL_CIRCLE / NAKSHATRA_COUNT;
    public static final double PADA_SPAN = FULL_CIRCLE / 108;

    private Longitudes() {
    }

    /**
     * Maps any finite angle into [0, 360). Idempotent.
     */
    public static double normalize(final double longitude) {
        var result = longitude % FULL_CIRCLE;
        if (result < 0) {
            result += FULL_CIRCLE;
        }
        // -1e-15 + 360 rounds up to 360.0; -0.0 becomes 0.0
        if (result >= FULL_CIRCLE) {
            return 0.0;
        }
        return result + 0.0;
    }

    public static double opposite(final double longitude) {
        return normalize(longitude + 180.0);
    }

    public static int signIndex(final double longitude) {
        return (int) Math.floor(normalize(longitude) / SIGN_SPAN) % 12;
    }

    public static double degreeInSign(final double longitude) {
        return normalize(longitude) - signIndex(longitude) * SIGN_SPAN;
    }

    /**
     * Decan of a position given its degree within the sign: below 10 is the first,
     * below 20 the second, anything else the third.
     */
    public static int decan(final double degreeInSign) {
        if (degreeInSign < DECAN_SPAN) {
            return 1;
        }
        if (degreeInSign < 2 * DECAN_SPAN) {
            return 2;
        }
        return 3;
    }

    public static ZodiacPosition position(final double longitude) {
        final var normalized = normalize(longitude);
        final var inSign = degreeInSign(normalized);
        final var degree = (int) Math.floor(inSign);
        final var minute = Math.min(59, (int) Math.floor((inSign - degree) * 60.0));
        return new ZodiacPosition(normalized, ZodiacSign.ofIndex(signIndex(normalized)), degree, minute,
                decan(inSign));
    }

    /**
     * Whole-sign house of a body counted from the ascendant's sign, 1..12.
     */
    public static int wholeSignHouse(final double bodyLongitude, final double ascendantLongitude) {
        return ((signIndex(bodyLongitude) - signIndex(ascendantLongitude) + 12) % 12) + 1;
    }

    /**
     * House containing a longitude, for a 13-slot cusp array (slot 0 unused).
     *
     * <p>A house whose cusp is greater than the next cusp straddles 0°, and contains the
     * longitude when it lies at or after the cusp or before the next one.
     *
     * @return house 1..12, or empty when the cusps do not partition the circle
     */
    public static OptionalInt houseOf(final double longitude, final double[] cusps) {
        final var target = normalize(longitude);
        for (var house = 1; house <= 12; house++) {
            final var cusp = normalize(cusps[house]);
            final var next = normalize(cusps[house == 12 ? 1 : house + 1]);
            if (inSpan(target, cusp, next)) {
                return OptionalInt.of(house);
            }
        }
        return OptionalInt.empty();
    }

    static boolean inSpan(final double longitude, final double cusp, final double next) {
        if (cusp > next) {
            return longitude >= cusp || longitude < next;
        }
        return longitude >= cusp && longitude < next;
    }

    /**
     * Lunar sector (nakshatra) index, 0..26.
     */
    public static int nakshatraIndex(final double longitude) {
        return (int) Math.floor(normalize(longitude) / NAKSHATRA_SPAN) % NAKSHATRA_COUNT;
    }

    /**
     * Quarter (pada) of the lunar sector, 1..4.
     */
    public static int pada(final double longitude) {
        final var withinSector = normalize(longitude) % NAKSHATRA_SPAN;
        return Math.min(4, (int) Math.floor(withinSector / PADA_SPAN) + 1);
    }

    /**
     * Smallest angle between two longitudes, 0..180.
     */
    public static double angularDistance(final double a, final double b) {
        final var diff = Math.abs(normalize(a) - normalize(b));
        return diff > 180.0 ? FULL_CIRCLE - diff : diff;
    }
}
