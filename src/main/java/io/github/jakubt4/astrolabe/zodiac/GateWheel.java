package io.github.jakubt4.astrolabe.zodiac;

import java.util.Arrays;
import java.util.List;

/**
 * The 64-gate wheel shared by both gate-based derived systems.
 *
 * <p>The circle is cut into 64 equal sectors of 5.625°, each split into six lines of 0.9375°.
 * Sector {@code i} carries gate {@code SEQUENCE[i]}. This is the only implementation of that
 * boundary arithmetic; downstream adapters must call it rather than re-derive it.
 */
public final class GateWheel {

    public static final int GATE_COUNT = 64;
    public static final int LINES_PER_GATE = 6;
    public static final double GATE_SPAN = Longitudes.FULL_CIRCLE / GATE_COUNT;
    public static final double LINE_SPAN = GATE_SPAN / LINES_PER_GATE;

    /**
     * Tropical longitude at which sector 0 (gate 41) begins: 2° Aquarius.
     */
    public static final double ECLIPTIC_ORIGIN = 302.0;

    /*
     * Traditional gate order around the wheel, as published for the I Ching based body graph
     * and reused unchanged by the hologenetic profile. It follows the King Wen hexagrams laid
     * on the zodiac, not any numeric rule: never regenerate it.
     */
    private static final int[] SEQUENCE = {
            41, 19, 13, 49, 30, 55, 37, 63, 22, 36, 25, 17, 21, 51, 42, 3,
            27, 24, 2, 23, 8, 20, 16, 35, 45, 12, 15, 52, 39, 53, 62, 56,
            31, 33, 7, 4, 29, 59, 40, 64, 47, 6, 46, 18, 48, 57, 32, 50,
            28, 44, 1, 43, 14, 34, 9, 5, 26, 11, 10, 58, 38, 54, 61, 60
    };

    private GateWheel() {
    }

    /**
     * Sector of a wheel longitude, 0..63.
     */
    public static int sectorIndex(final double wheelLongitude) {
        return (int) Math.floor(Longitudes.normalize(wheelLongitude) / GATE_SPAN) % GATE_COUNT;
    }

    /**
     * Gate number at a wheel longitude (measured from the start of sector 0).
     */
    public static int gateOf(final double wheelLongitude) {
        return SEQUENCE[sectorIndex(wheelLongitude)];
    }

    /**
     * Line within the gate, 1..6.
     */
    public static int lineOf(final double wheelLongitude) {
        final var withinGate = Longitudes.normalize(wheelLongitude) % GATE_SPAN;
        return Math.min(LINES_PER_GATE, (int) Math.floor(withinGate / LINE_SPAN) + 1);
    }

    /**
     * Gate and line of a tropical ecliptic longitude.
     */
    public static Activation activation(final double eclipticLongitude) {
        final var wheelLongitude = toWheel(eclipticLongitude);
        return new Activation(gateOf(wheelLongitude), lineOf(wheelLongitude));
    }

    public static double toWheel(final double eclipticLongitude) {
        return Longitudes.normalize(eclipticLongitude - ECLIPTIC_ORIGIN);
    }

    public static List<Integer> sequence() {
        return Arrays.stream(SEQUENCE).boxed().toList();
    }

    /**
     * A gate activation: gate 1..64 and line 1..6.
     */
    public record Activation(int gate, int line) {
    }
}
