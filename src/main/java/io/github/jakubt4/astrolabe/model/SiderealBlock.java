package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.ephemeris.SiderealMethod;
import io.github.jakubt4.astrolabe.zodiac.Graha;
import io.github.jakubt4.astrolabe.zodiac.Nakshatra;
import io.github.jakubt4.astrolabe.zodiac.ZodiacSign;

import java.util.List;

/**
 * Sidereal (fixed-star frame) half of a {@link PlacementAggregate}.
 *
 * @param correctionAngle angle subtracted from tropical longitudes at this instant, degrees
 * @param provenance      whether the house frame came from the provider or from the fallback
 * @param houseCusps      whole-sign cusps of houses 1..12
 * @param nakshatraIndex  lunar sector of the Moon, 0..26; authoritative over the sign for
 *                        interpretation
 * @param pada            quarter of that sector, 1..4
 * @param grahas          Sun, Moon, Mars, Mercury, Jupiter, Venus, Saturn, mean Rahu and Ketu,
 *                        then true Rahu and Ketu
 * @param dasha           the nine Vimshottari mahadashas from birth
 */
public record SiderealBlock(SiderealMethod method,
                            double correctionAngle,
                            SiderealProvenance provenance,
                            double sunLongitude,
                            double moonLongitude,
                            double ascendantLongitude,
                            List<Double> houseCusps,
                            ZodiacSign ascendantSign,
                            Graha ascendantLord,
                            ZodiacSign moonSign,
                            ZodiacSign sunSign,
                            Nakshatra nakshatra,
                            int nakshatraIndex,
                            int pada,
                            Graha nakshatraLord,
                            NodePair meanNodes,
                            NodePair trueNodes,
                            List<GrahaRow> grahas,
                            NavamshaChart navamsha,
                            List<DashaPeriod> dasha) {

    public boolean degraded() {
        return provenance == SiderealProvenance.TROPICAL_MINUS_CORRECTION;
    }
}
