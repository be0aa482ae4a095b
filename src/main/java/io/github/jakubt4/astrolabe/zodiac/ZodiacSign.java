package io.github.jakubt4.astrolabe.zodiac;

/**
 * The twelve 30° signs, starting at 0° Aries, with their traditional (pre-modern) rulers.
 */
public enum ZodiacSign {
    ARIES("Aries", Graha.MARS),
    TAURUS("Taurus", Graha.VENUS),
    GEMINI("Gemini", Graha.MERCURY),
    CANCER("Cancer", Graha.MOON),
    LEO("Leo", Graha.SUN),
    VIRGO("Virgo", Graha.MERCURY),
    LIBRA("Libra", Graha.VENUS),
    SCORPIO("Scorpio", Graha.MARS),
    SAGITTARIUS("Sagittarius", Graha.JUPITER),
    CAPRICORN("Capricorn", Graha.SATURN),
    AQUARIUS("Aquarius", Graha.SATURN),
    PISCES("Pisces", Graha.JUPITER);

    private static final ZodiacSign[] ORDER = values();

    private final String displayName;
    private final Graha ruler;

    ZodiacSign(final String displayName, final Graha ruler) {
        this.displayName = displayName;
        this.ruler = ruler;
    }

    public String displayName() {
        return displayName;
    }

    public Graha ruler() {
        return ruler;
    }

    public static ZodiacSign ofIndex(final int index) {
        return ORDER[Math.floorMod(index, ORDER.length)];
    }

    public static ZodiacSign of(final double longitude) {
        return ofIndex(Longitudes.signIndex(longitude));
    }
}
