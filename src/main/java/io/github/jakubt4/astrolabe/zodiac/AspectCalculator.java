package io.github.jakubt4.astrolabe.zodiac;

import io.github.jakubt4.astrolabe.model.Aspect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Detects major aspects between every pair of chart points.
 *
 * <p>Each pair yields at most one aspect, the closest one within the orb. The result is sorted
 * by aspect name, then orb, then {@code "a|b"}, so identical inputs always serialize
 * identically.
 */
public final class AspectCalculator {

    public static final double EXACT_ORB = 1.0;

    private static final Comparator<Aspect> STABLE_ORDER = Comparator
            .comparing((Aspect aspect) -> aspect.type().name())
            .thenComparingDouble(Aspect::orb)
            .thenComparing(aspect -> aspect.a() + "|" + aspect.b());

    private AspectCalculator() {
    }

    public static List<Aspect> majorAspects(final List<ChartPoint> points, final double maxOrb) {
        final var aspects = new ArrayList<Aspect>();
        for (var i = 0; i < points.size(); i++) {
            for (var j = i + 1; j < points.size(); j++) {
                final var first = points.get(i);
                final var second = points.get(j);
                final var distance = Longitudes.angularDistance(first.longitude(), second.longitude());

                AspectType best = null;
                var bestOrb = Double.MAX_VALUE;
                for (final var type : AspectType.values()) {
                    final var orb = Math.abs(distance - type.angle());
                    if (orb <= maxOrb && orb < bestOrb) {
                        best = type;
                        bestOrb = orb;
                    }
                }
                if (best != null) {
                    aspects.add(new Aspect(first.name(), second.name(), best,
                            Math.round(bestOrb * 100.0) / 100.0, bestOrb <= EXACT_ORB));
                }
            }
        }
        aspects.sort(STABLE_ORDER);
        return List.copyOf(aspects);
    }
}
