package io.github.jakubt4.astrolabe.derived;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.config.AstrolabeProperties.DesignStrategy;
import io.github.jakubt4.astrolabe.ephemeris.EphemerisBody;
import io.github.jakubt4.astrolabe.ephemeris.EphemerisSession;
import io.github.jakubt4.astrolabe.model.UtInstant;
import io.github.jakubt4.astrolabe.zodiac.Longitudes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Derives the design instant that precedes a birth instant.
 *
 * <p>{@link DesignStrategy#FIXED_DAYS} steps back {@code offset} days. {@link DesignStrategy#SOLAR_ARC}
 * bisects for the moment the tropical Sun stood {@code offset} degrees behind its birth
 * longitude, searching from {@code offset + 8} to {@code offset - 4} days before birth.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DesignInstantCalculator {

    static final double ARC_TOLERANCE = 1e-5;
    static final int MAX_ITERATIONS = 100;
    private static final double WINDOW_BEFORE = 8.0;
    private static final double WINDOW_AFTER = 4.0;

    private final AstrolabeProperties properties;

    public UtInstant computeDesignInstant(final UtInstant birth, final EphemerisSession session) {
        final var design = properties.getDesign();
        return switch (design.getStrategy()) {
            case FIXED_DAYS -> birth.minusDays(design.getOffset());
            case SOLAR_ARC -> solarArc(birth, design.getOffset(), session);
        };
    }

    private UtInstant solarArc(final UtInstant birth, final double arc, final EphemerisSession session) {
        final var birthSun = session.tropical(birth, EphemerisBody.SUN).longitude();
        final var target = Longitudes.normalize(birthSun - arc);

        // days before birth; the Sun's lag behind target shrinks as we move towards birth
        var early = arc + WINDOW_BEFORE;
        var late = arc - WINDOW_AFTER;
        var mid = (early + late) / 2.0;
        for (var i = 0; i < MAX_ITERATIONS; i++) {
            mid = (early + late) / 2.0;
            final var sun = session.tropical(birth.minusDays(mid), EphemerisBody.SUN).longitude();
            final var error = signedDifference(sun, target);
            if (Math.abs(error) < ARC_TOLERANCE) {
                break;
            }
            if (error > 0) {
                late = mid;
            } else {
                early = mid;
            }
        }
        log.debug("[EPHEMERIS] Design instant {} days before JD {}", mid, birth.julianDay());
        return birth.minusDays(mid);
    }

    /**
     * {@code a - b} folded into (-180, 180].
     */
    static double signedDifference(final double a, final double b) {
        var diff = Longitudes.normalize(a - b);
        if (diff > 180.0) {
            diff -= Longitudes.FULL_CIRCLE;
        }
        return diff;
    }
}
