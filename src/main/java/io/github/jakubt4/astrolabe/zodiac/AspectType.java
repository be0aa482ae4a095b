package io.github.jakubt4.astrolabe.zodiac;

/**
 * The five Ptolemaic aspects and their exact angles.
 */
public enum AspectType {
    CONJUNCTION(0.0),
    SEXTILE(60.0),
    SQUARE(90.0),
    TRINE(120.0),
    OPPOSITION(180.0);

    private final double angle;

    AspectType(final double angle) {
        this.angle = angle;
    }

    public double angle() {
        return angle;
    }
}
