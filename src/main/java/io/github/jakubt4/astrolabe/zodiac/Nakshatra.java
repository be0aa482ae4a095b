package io.github.jakubt4.astrolabe.zodiac;

/**
 * The 27 lunar mansions of 13°20' each, starting at 0° sidereal Aries.
 *
 * <p>Names follow the common Sanskrit transliteration; lords follow the Vimshottari cycle
 * Ketu, Venus, Sun, Moon, Mars, Rahu, Jupiter, Saturn, Mercury repeated three times from
 * Ashwini. This is reference data and is not derived from any formula.
 */
public enum Nakshatra {
    ASHWINI("Ashwini", Graha.KETU),
    BHARANI("Bharani", Graha.VENUS),
    KRITTIKA("Krittika", Graha.SUN),
    ROHINI("Rohini", Graha.MOON),
    MRIGASHIRA("Mrigashira", Graha.MARS),
    ARDRA("Ardra", Graha.RAHU),
    PUNARVASU("Punarvasu", Graha.JUPITER),
    PUSHYA("Pushya", Graha.SATURN),
    ASHLESHA("Ashlesha", Graha.MERCURY),
    MAGHA("Magha", Graha.KETU),
    PURVA_PHALGUNI("Purva Phalguni", Graha.VENUS),
    UTTARA_PHALGUNI("Uttara Phalguni", Graha.SUN),
    HASTA("Hasta", Graha.MOON),
    CHITRA("Chitra", Graha.MARS),
    SWATI("Swati", Graha.RAHU),
    VISHAKHA("Vishakha", Graha.JUPITER),
    ANURADHA("Anuradha", Graha.SATURN),
    JYESHTHA("Jyeshtha", Graha.MERCURY),
    MULA("Mula", Graha.KETU),
    PURVA_ASHADHA("Purva Ashadha", Graha.VENUS),
    UTTARA_ASHADHA("Uttara Ashadha", Graha.SUN),
    SHRAVANA("Shravana", Graha.MOON),
    DHANISHTHA("Dhanishtha", Graha.MARS),
    SHATABHISHA("Shatabhisha", Graha.RAHU),
    PURVA_BHADRAPADA("Purva Bhadrapada", Graha.JUPITER),
    UTTARA_BHADRAPADA("Uttara Bhadrapada", Graha.SATURN),
    REVATI("Revati", Graha.MERCURY);

    private static final Nakshatra[] ORDER = values();

    private final String displayName;
    private final Graha lord;

    Nakshatra(final String displayName, final Graha lord) {
        this.displayName = displayName;
        this.lord = lord;
    }

    public String displayName() {
        return displayName;
    }

    public Graha lord() {
        return lord;
    }

    public static Nakshatra ofIndex(final int index) {
        return ORDER[index];
    }

    public static Nakshatra of(final double siderealLongitude) {
        return ofIndex(Longitudes.nakshatraIndex(siderealLongitude));
    }
}
