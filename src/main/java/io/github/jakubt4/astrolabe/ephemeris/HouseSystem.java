package io.github.jakubt4.astrolabe.ephemeris;

/**
 * House systems supported by {@link EphemerisProvider#calcHouses}, keyed by their
 * conventional single-letter code.
 */
public enum HouseSystem {
    PLACIDUS('P'),
    PORPHYRY('O'),
    EQUAL('E'),
    WHOLE_SIGN('W');

    private final char code;

    HouseSystem(final char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }
}
