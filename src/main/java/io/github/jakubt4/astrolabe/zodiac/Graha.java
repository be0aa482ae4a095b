package io.github.jakubt4.astrolabe.zodiac;

/**
 * The nine grahas of the sidereal system. Also used as traditional sign and sector rulers.
 */
public enum Graha {
    SUN("Sun"),
    MOON("Moon"),
    MARS("Mars"),
    MERCURY("Mercury"),
    JUPITER("Jupiter"),
    VENUS("Venus"),
    SATURN("Saturn"),
    RAHU("Rahu"),
    KETU("Ketu");

    private final String displayName;

    Graha(final String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
