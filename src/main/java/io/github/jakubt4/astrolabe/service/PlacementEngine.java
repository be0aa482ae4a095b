package io.github.jakubt4.astrolabe.service;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.ephemeris.EphemerisProviderFactory;
import io.github.jakubt4.astrolabe.ephemeris.EphemerisSession;
import io.github.jakubt4.astrolabe.ephemeris.ProviderCalculationException;
import io.github.jakubt4.astrolabe.model.BirthMoment;
import io.github.jakubt4.astrolabe.model.PlacementAggregate;
import io.github.jakubt4.astrolabe.model.SiderealBlock;
import io.github.jakubt4.astrolabe.model.TropicalBlock;
import io.github.jakubt4.astrolabe.model.UtInstant;

import java.time.ZonedDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Computes one {@link PlacementAggregate}: resolve the instant, build the tropical block, then
 * transform into the sidereal block, all against one provider instance that no other
 * computation sees.
 *
 * <p>Provider failures in the tropical block propagate. A sidereal block the provider cannot
 * compute is left out of the aggregate and the tropical block is still returned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlacementEngine {

    private final EphemerisProviderFactory providerFactory;
    private final TemporalResolver temporalResolver;
    private final TropicalPlacementCalculator tropicalCalculator;
    private final SiderealTransform siderealTransform;
    private final AstrolabeProperties properties;

    public EphemerisSession openSession() {
        return new EphemerisSession(providerFactory.create(), properties.getEphemeris().getSiderealMethod());
    }

    public PlacementAggregate compute(final BirthMoment birth) {
        final var session = openSession();
        final var resolved = temporalResolver.resolve(birth, session);
        final var instant = resolved.instant();

        final var tropical = tropicalCalculator.compute(instant, birth, session);
        final var sidereal = siderealOrNull(instant, birth, resolved.localTime(), tropical, session);

        if (sidereal == null) {
            log.info("[EPHEMERIS] Placement JD {} | tropical Sun {} Moon {} Asc {} | sidereal unavailable",
                    String.format("%.5f", instant.julianDay()),
                    tropical.sun().sign(), tropical.moon().sign(), tropical.ascendant().sign());
        } else {
            log.info("[EPHEMERIS] Placement JD {} | tropical Sun {} Moon {} Asc {} | sidereal ({}) Moon {} {} pada {}{}",
                    String.format("%.5f", instant.julianDay()),
                    tropical.sun().sign(), tropical.moon().sign(), tropical.ascendant().sign(),
                    sidereal.method(), sidereal.moonSign(), sidereal.nakshatra(), sidereal.pada(),
                    sidereal.degraded() ? " [DEGRADED]" : "");
        }
        return new PlacementAggregate(birth, instant, tropical, sidereal);
    }

    private SiderealBlock siderealOrNull(final UtInstant instant, final BirthMoment birth, final ZonedDateTime birthTime,
                                         final TropicalBlock tropical, final EphemerisSession session) {
        try {
            return siderealTransform.compute(instant, birth, birthTime, tropical, session);
        } catch (final ProviderCalculationException e) {
            log.warn("[EPHEMERIS] Sidereal block unavailable for JD {}, returning tropical placements only: {}",
                    String.format("%.5f", instant.julianDay()), e.getMessage());
            return null;
        }
    }
}
