package io.github.jakubt4.astrolabe.zodiac;

/**
 * Ninth-harmonic (D-9) sign of a sidereal longitude.
 *
 * <p>Each sign is cut into nine parts of 3°20'. Counting starts from the first sign of the
 * sign's element: Aries for fire, Capricorn for earth, Libra for air, Cancer for water.
 */
public final class Navamsha {

    private static final double PART_SPAN = Longitudes.SIGN_SPAN / 9;

    // fire, earth, air, water: indexed by sign index mod 4
    private static final int[] ELEMENT_START = {0, 9, 6, 3};

    private Navamsha() {
    }

    public static ZodiacSign signOf(final double siderealLongitude) {
        final var signIndex = Longitudes.signIndex(siderealLongitude);
        final var part = Math.min(8, (int) Math.floor(Longitudes.degreeInSign(siderealLongitude) / PART_SPAN));
        return ZodiacSign.ofIndex(ELEMENT_START[signIndex % 4] + part);
    }
}
