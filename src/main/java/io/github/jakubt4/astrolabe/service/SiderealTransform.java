package io.github.jakubt4.astrolabe.service;

import io.github.jakubt4.astrolabe.ephemeris.EphemerisBody;
import io.github.jakubt4.astrolabe.ephemeris.EphemerisSession;
import io.github.jakubt4.astrolabe.ephemeris.HouseSystem;
import io.github.jakubt4.astrolabe.ephemeris.ProviderCalculationException;
import io.github.jakubt4.astrolabe.model.BirthMoment;
import io.github.jakubt4.astrolabe.model.GrahaRow;
import io.github.jakubt4.astrolabe.model.NavamshaChart;
import io.github.jakubt4.astrolabe.model.NodePair;
import io.github.jakubt4.astrolabe.model.SiderealBlock;
import io.github.jakubt4.astrolabe.model.SiderealProvenance;
import io.github.jakubt4.astrolabe.model.TropicalBlock;
import io.github.jakubt4.astrolabe.model.UtInstant;
import io.github.jakubt4.astrolabe.zodiac.Graha;
import io.github.jakubt4.astrolabe.zodiac.Longitudes;
import io.github.jakubt4.astrolabe.zodiac.Nakshatra;
import io.github.jakubt4.astrolabe.zodiac.Navamsha;
import io.github.jakubt4.astrolabe.zodiac.VimshottariDasha;
import io.github.jakubt4.astrolabe.zodiac.ZodiacSign;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the sidereal block from the same instant as the tropical block.
 *
 * <p>Every provider call goes through the session, which switches the provider into sidereal
 * mode right before it. When the sidereal whole-sign frame cannot be computed the ascendant is
 * taken from the tropical block minus the correction angle; that block is marked
 * {@link SiderealProvenance#TROPICAL_MINUS_CORRECTION}. Body failures are not recoverable.
 */
@Slf4j
@Component
public class SiderealTransform {

    private static final Map<Graha, EphemerisBody> BODIES = new LinkedHashMap<>();

    static {
        BODIES.put(Graha.SUN, EphemerisBody.SUN);
        BODIES.put(Graha.MOON, EphemerisBody.MOON);
        BODIES.put(Graha.MARS, EphemerisBody.MARS);
        BODIES.put(Graha.MERCURY, EphemerisBody.MERCURY);
        BODIES.put(Graha.JUPITER, EphemerisBody.JUPITER);
        BODIES.put(Graha.VENUS, EphemerisBody.VENUS);
        BODIES.put(Graha.SATURN, EphemerisBody.SATURN);
    }

    public SiderealBlock compute(final UtInstant instant, final BirthMoment birth, final ZonedDateTime birthTime,
                                 final TropicalBlock tropical, final EphemerisSession session) {
        final var correction = session.correctionAngle(instant);

        final var longitudes = new LinkedHashMap<Graha, Double>();
        BODIES.forEach((graha, body) -> longitudes.put(graha, session.sidereal(instant, body).longitude()));
        final var meanNodes = NodePair.of(session.sidereal(instant, EphemerisBody.MEAN_NODE).longitude());
        final var trueNodes = NodePair.of(session.sidereal(instant, EphemerisBody.TRUE_NODE).longitude());

        final var frame = houseFrame(instant, birth, tropical, correction, session);
        final var ascendant = frame.ascendant();

        final var grahas = new ArrayList<GrahaRow>();
        longitudes.forEach((graha, longitude) -> grahas.add(row(graha, longitude, ascendant, false)));
        grahas.add(row(Graha.RAHU, meanNodes.rahuLongitude(), ascendant, false));
        grahas.add(row(Graha.KETU, meanNodes.ketuLongitude(), ascendant, false));
        grahas.add(row(Graha.RAHU, trueNodes.rahuLongitude(), ascendant, true));
        grahas.add(row(Graha.KETU, trueNodes.ketuLongitude(), ascendant, true));

        final var moon = longitudes.get(Graha.MOON);
        final var sun = longitudes.get(Graha.SUN);
        final var ascendantSign = ZodiacSign.of(ascendant);
        final var nakshatra = Nakshatra.of(moon);

        return new SiderealBlock(session.siderealMethod(),
                correction,
                frame.provenance(),
                sun,
                moon,
                ascendant,
                frame.cusps(),
                ascendantSign,
                ascendantSign.ruler(),
                ZodiacSign.of(moon),
                ZodiacSign.of(sun),
                nakshatra,
                Longitudes.nakshatraIndex(moon),
                Longitudes.pada(moon),
                nakshatra.lord(),
                meanNodes,
                trueNodes,
                List.copyOf(grahas),
                navamsha(ascendant, grahas),
                VimshottariDasha.timeline(moon, birthTime));
    }

    private static Frame houseFrame(final UtInstant instant, final BirthMoment birth, final TropicalBlock tropical,
                                    final double correction, final EphemerisSession session) {
        try {
            final var houses = session.siderealHouses(instant, birth.latitude(), birth.longitude(),
                    HouseSystem.WHOLE_SIGN);
            return new Frame(houses.ascendant(), houses.toList(), SiderealProvenance.EPHEMERIS);
        } catch (final ProviderCalculationException e) {
            final var ascendant = Longitudes.normalize(tropical.ascendant().longitude() - correction);
            log.warn("[EPHEMERIS] Sidereal houses failed at JD {} ({}), using tropical ascendant minus {} deg",
                    instant.julianDay(), e.getMessage(), correction);
            return new Frame(ascendant, wholeSignCusps(ascendant), SiderealProvenance.TROPICAL_MINUS_CORRECTION);
        }
    }

    private static GrahaRow row(final Graha graha, final double longitude, final double ascendant,
                                final boolean trueNode) {
        final var position = Longitudes.position(longitude);
        return new GrahaRow(graha,
                position.longitude(),
                position.sign(),
                position.degree(),
                position.minute(),
                Longitudes.wholeSignHouse(longitude, ascendant),
                Nakshatra.of(longitude),
                Longitudes.pada(longitude),
                trueNode);
    }

    private static NavamshaChart navamsha(final double ascendant, final List<GrahaRow> grahas) {
        final var entries = grahas.stream()
                .filter(row -> !row.trueNode())
                .map(row -> new NavamshaChart.Entry(row.graha(), Navamsha.signOf(row.longitude())))
                .toList();
        return new NavamshaChart(Navamsha.signOf(ascendant), entries);
    }

    private static List<Double> wholeSignCusps(final double ascendant) {
        final var start = Longitudes.signIndex(ascendant) * Longitudes.SIGN_SPAN;
        final var cusps = new ArrayList<Double>(12);
        for (var house = 0; house < 12; house++) {
            cusps.add(Longitudes.normalize(start + house * Longitudes.SIGN_SPAN));
        }
        return List.copyOf(cusps);
    }

    private record Frame(double ascendant, List<Double> cusps, SiderealProvenance provenance) {
    }
}
