package io.github.jakubt4.astrolabe.service;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.ephemeris.EphemerisProviderFactory;
import io.github.jakubt4.astrolabe.ephemeris.FakeEphemerisProvider;
import io.github.jakubt4.astrolabe.model.BirthMoment;

/**
 * Placement engines wired by hand around {@link FakeEphemerisProvider}.
 */
public final class Engines {

    public static final BirthMoment BRATISLAVA = new BirthMoment("1990-06-15", "14:30", "Europe/Bratislava",
            48.1486, 17.1077);

    private Engines() {
    }

    public static PlacementEngine engine(final EphemerisProviderFactory factory) {
        return engine(factory, new AstrolabeProperties());
    }

    public static PlacementEngine engine(final EphemerisProviderFactory factory, final AstrolabeProperties properties) {
        return new PlacementEngine(factory,
                new TemporalResolver(),
                new TropicalPlacementCalculator(properties),
                new SiderealTransform(),
                properties);
    }

    public static PlacementEngine fakeEngine() {
        return engine(FakeEphemerisProvider::new);
    }
}
