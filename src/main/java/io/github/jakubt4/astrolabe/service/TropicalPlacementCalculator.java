package io.github.jakubt4.astrolabe.service;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.ephemeris.BodyPosition;
import io.github.jakubt4.astrolabe.ephemeris.EphemerisBody;
import io.github.jakubt4.astrolabe.ephemeris.EphemerisSession;
import io.github.jakubt4.astrolabe.ephemeris.HouseCusps;
import io.github.jakubt4.astrolabe.ephemeris.ProviderCalculationException;
import io.github.jakubt4.astrolabe.model.BirthMoment;
import io.github.jakubt4.astrolabe.model.NodeAxis;
import io.github.jakubt4.astrolabe.model.PlanetPlacement;
import io.github.jakubt4.astrolabe.model.TropicalBlock;
import io.github.jakubt4.astrolabe.model.UtInstant;
import io.github.jakubt4.astrolabe.zodiac.AspectCalculator;
import io.github.jakubt4.astrolabe.zodiac.ChartPoint;
import io.github.jakubt4.astrolabe.zodiac.Longitudes;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the tropical block: the ten bodies with speed, the configured house frame, the mean
 * node axis and the major aspects between them. Any provider failure aborts the whole block.
 */
@Component
@RequiredArgsConstructor
public class TropicalPlacementCalculator {

    private final AstrolabeProperties properties;

    public TropicalBlock compute(final UtInstant instant, final BirthMoment birth, final EphemerisSession session) {
        final var system = properties.getEphemeris().getHouseSystem();
        final var houses = session.tropicalHouses(instant, birth.latitude(), birth.longitude(), system);

        final var planets = new ArrayList<PlanetPlacement>(EphemerisBody.PLANETS.size());
        for (final var body : EphemerisBody.PLANETS) {
            planets.add(placement(session.tropical(instant, body), houses));
        }
        final var sun = planets.get(0);
        final var moon = planets.get(1);

        final var node = session.tropical(instant, EphemerisBody.MEAN_NODE);
        final var north = node.longitude();
        final var south = Longitudes.opposite(north);
        final var nodes = new NodeAxis(north, south, houseOf(north, houses), houseOf(south, houses),
                node.longitudeSpeed() < 0);

        final var points = new ArrayList<ChartPoint>();
        planets.forEach(p -> points.add(new ChartPoint(p.body().name(), p.longitude())));
        points.add(new ChartPoint("ASCENDANT", houses.ascendant()));
        points.add(new ChartPoint("MIDHEAVEN", houses.mc()));
        points.add(new ChartPoint("NORTH_NODE", north));
        points.add(new ChartPoint("SOUTH_NODE", south));

        return new TropicalBlock(system,
                Longitudes.position(sun.longitude()),
                Longitudes.position(moon.longitude()),
                Longitudes.position(houses.ascendant()),
                sun.house(),
                moon.house(),
                houses.mc(),
                houses.toList(),
                List.copyOf(planets),
                nodes,
                AspectCalculator.majorAspects(points, properties.getAspects().getOrb()));
    }

    private static PlanetPlacement placement(final BodyPosition position, final HouseCusps houses) {
        final var zodiac = Longitudes.position(position.longitude());
        return new PlanetPlacement(position.body(),
                zodiac.longitude(),
                position.longitudeSpeed(),
                position.longitudeSpeed() < 0,
                zodiac.sign(),
                zodiac.degree(),
                zodiac.minute(),
                houseOf(position.longitude(), houses));
    }

    private static int houseOf(final double longitude, final HouseCusps houses) {
        return Longitudes.houseOf(longitude, houses.cusps())
                .orElseThrow(() -> new ProviderCalculationException(
                        "House cusps do not partition the circle; no house for " + longitude));
    }
}
