package io.github.jakubt4.astrolabe.ephemeris;

import io.github.jakubt4.astrolabe.zodiac.Longitudes;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;

/**
 * Spherical-astronomy construction of house frames from the local sidereal angle.
 *
 * <p>Inputs are the right ascension of the meridian (RAMC), the obliquity of the ecliptic and
 * the geographic latitude, all in degrees. Placidus cusps are found by iterating on the
 * semi-arc division of each intermediate cusp; above the polar circles, where some ecliptic
 * degrees never rise, Placidus is undefined and the frame falls back to Porphyry.
 *
 * <p>Inside the polar circles the horizon/ecliptic intersection given by the ascendant formula
 * can be the western one; the ascendant is then taken as its opposite so that it always lies in
 * the eastern half of the frame, less than 180 degrees ahead of the midheaven.
 */
@Slf4j
final class HouseGeometry {

    private static final int MAX_ITERATIONS = 100;
    private static final double CONVERGENCE = 1e-10;

    private HouseGeometry() {
    }

    /**
     * Builds a house frame.
     *
     * @param shift degrees subtracted from every returned longitude (the sidereal correction,
     *              or {@code 0} for tropical frames); whole-sign and equal cusps are laid out
     *              from the shifted ascendant
     */
    static HouseCusps compute(final HouseSystem system, final double ramc, final double obliquity,
                              final double latitude, final double shift) {
        final var mc = midheaven(ramc, obliquity);
        final var ascendant = easternAscendant(ascendant(ramc, obliquity, latitude), mc, latitude);
        final var shiftedAscendant = Longitudes.normalize(ascendant - shift);
        final var cusps = new double[HouseCusps.SLOTS];

        switch (system) {
            case PLACIDUS -> {
                if (!placidus(cusps, ramc, obliquity, latitude, ascendant, mc)) {
                    log.warn("Placidus undefined at latitude {} deg, using Porphyry cusps", latitude);
                    porphyry(cusps, ascendant, mc);
                }
                shiftAll(cusps, shift);
            }
            case PORPHYRY -> {
                porphyry(cusps, ascendant, mc);
                shiftAll(cusps, shift);
            }
            case EQUAL -> {
                for (var house = 1; house <= 12; house++) {
                    cusps[house] = Longitudes.normalize(shiftedAscendant + 30.0 * (house - 1));
                }
            }
            case WHOLE_SIGN -> {
                final var signStart = Longitudes.signIndex(shiftedAscendant) * Longitudes.SIGN_SPAN;
                for (var house = 1; house <= 12; house++) {
                    cusps[house] = Longitudes.normalize(signStart + 30.0 * (house - 1));
                }
            }
        }
        return new HouseCusps(shiftedAscendant, Longitudes.normalize(mc - shift), cusps);
    }

    static double ascendant(final double ramc, final double obliquity, final double latitude) {
        final var r = FastMath.toRadians(ramc);
        final var e = FastMath.toRadians(obliquity);
        final var phi = FastMath.toRadians(latitude);
        final var y = FastMath.cos(r);
        final var x = -(FastMath.sin(r) * FastMath.cos(e) + FastMath.tan(phi) * FastMath.sin(e));
        return Longitudes.normalize(FastMath.toDegrees(FastMath.atan2(y, x)));
    }

    private static double easternAscendant(final double ascendant, final double mc, final double latitude) {
        if (Longitudes.normalize(ascendant - mc) > 180.0) {
            log.debug("Western horizon point at latitude {} deg, using the opposite ascendant", latitude);
            return Longitudes.opposite(ascendant);
        }
        return ascendant;
    }

    static double midheaven(final double ramc, final double obliquity) {
        return eclipticLongitudeOfRightAscension(ramc, obliquity);
    }

    private static double eclipticLongitudeOfRightAscension(final double rightAscension, final double obliquity) {
        final var a = FastMath.toRadians(rightAscension);
        final var e = FastMath.toRadians(obliquity);
        return Longitudes.normalize(FastMath.toDegrees(
                FastMath.atan2(FastMath.sin(a), FastMath.cos(a) * FastMath.cos(e))));
    }

    private static boolean placidus(final double[] cusps, final double ramc, final double obliquity,
                                    final double latitude, final double ascendant, final double mc) {
        // fraction of the diurnal (above) or nocturnal (below) semi-arc east of the meridian
        final var c11 = placidusCusp(ramc, obliquity, latitude, 1.0 / 3.0, true);
        final var c12 = placidusCusp(ramc, obliquity, latitude, 2.0 / 3.0, true);
        final var c2 = placidusCusp(ramc, obliquity, latitude, 1.0 / 3.0, false);
        final var c3 = placidusCusp(ramc, obliquity, latitude, 2.0 / 3.0, false);
        if (Double.isNaN(c11) || Double.isNaN(c12) || Double.isNaN(c2) || Double.isNaN(c3)) {
            return false;
        }
        cusps[1] = ascendant;
        cusps[2] = c2;
        cusps[3] = c3;
        cusps[10] = mc;
        cusps[11] = c11;
        cusps[12] = c12;
        mirror(cusps);
        return runsOnceAround(cusps);
    }

    /** True when consecutive cusps advance through the zodiac exactly once. */
    private static boolean runsOnceAround(final double[] cusps) {
        var total = 0.0;
        for (var house = 1; house <= 12; house++) {
            final var next = house == 12 ? 1 : house + 1;
            total += Longitudes.normalize(cusps[next] - cusps[house]);
        }
        return FastMath.abs(total - 360.0) < 1e-6;
    }

    /**
     * Solves RA = RAMC + f * DSA above the horizon, or RA = RAMC + DSA + f * NSA below it,
     * where the semi-arcs depend on the declination of the cusp itself.
     *
     * @return cusp longitude, or NaN if the cusp degree never crosses the horizon
     */
    private static double placidusCusp(final double ramc, final double obliquity, final double latitude,
                                       final double fraction, final boolean aboveHorizon) {
        final var sinE = FastMath.sin(FastMath.toRadians(obliquity));
        final var tanPhi = FastMath.tan(FastMath.toRadians(latitude));
        var rightAscension = ramc + (aboveHorizon ? fraction * 90.0 : 90.0 + fraction * 90.0);

        for (var i = 0; i < MAX_ITERATIONS; i++) {
            final var longitude = eclipticLongitudeOfRightAscension(rightAscension, obliquity);
            final var declination = FastMath.asin(sinE * FastMath.sin(FastMath.toRadians(longitude)));
            final var x = FastMath.tan(declination) * tanPhi;
            if (FastMath.abs(x) >= 1.0) {
                return Double.NaN;
            }
            final var ascensionalDifference = FastMath.toDegrees(FastMath.asin(x));
            final var diurnalSemiArc = 90.0 + ascensionalDifference;
            final var nocturnalSemiArc = 90.0 - ascensionalDifference;
            final var next = aboveHorizon
                    ? ramc + fraction * diurnalSemiArc
                    : ramc + diurnalSemiArc + fraction * nocturnalSemiArc;
            if (FastMath.abs(next - rightAscension) < CONVERGENCE) {
                rightAscension = next;
                break;
            }
            rightAscension = next;
        }
        return eclipticLongitudeOfRightAscension(rightAscension, obliquity);
    }

    private static void porphyry(final double[] cusps, final double ascendant, final double mc) {
        final var upperQuadrant = Longitudes.normalize(ascendant - mc);
        final var lowerQuadrant = 180.0 - upperQuadrant;
        cusps[1] = ascendant;
        cusps[10] = mc;
        cusps[11] = Longitudes.normalize(mc + upperQuadrant / 3.0);
        cusps[12] = Longitudes.normalize(mc + 2.0 * upperQuadrant / 3.0);
        cusps[2] = Longitudes.normalize(ascendant + lowerQuadrant / 3.0);
        cusps[3] = Longitudes.normalize(ascendant + 2.0 * lowerQuadrant / 3.0);
        mirror(cusps);
    }

    private static void mirror(final double[] cusps) {
        cusps[4] = Longitudes.opposite(cusps[10]);
        cusps[5] = Longitudes.opposite(cusps[11]);
        cusps[6] = Longitudes.opposite(cusps[12]);
        cusps[7] = Longitudes.opposite(cusps[1]);
        cusps[8] = Longitudes.opposite(cusps[2]);
        cusps[9] = Longitudes.opposite(cusps[3]);
    }

    private static void shiftAll(final double[] cusps, final double shift) {
        for (var house = 1; house <= 12; house++) {
            cusps[house] = Longitudes.normalize(cusps[house] - shift);
        }
    }
}
