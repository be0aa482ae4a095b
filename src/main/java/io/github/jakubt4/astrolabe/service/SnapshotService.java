package io.github.jakubt4.astrolabe.service;

import io.github.jakubt4.astrolabe.derived.ActivationPoint;
import io.github.jakubt4.astrolabe.derived.DesignInstantCalculator;
import io.github.jakubt4.astrolabe.derived.DualSnapshot;
import io.github.jakubt4.astrolabe.derived.LongitudeSnapshot;
import io.github.jakubt4.astrolabe.ephemeris.EphemerisSession;
import io.github.jakubt4.astrolabe.ephemeris.ProviderCalculationException;
import io.github.jakubt4.astrolabe.model.BirthMoment;
import io.github.jakubt4.astrolabe.model.UtInstant;
import io.github.jakubt4.astrolabe.zodiac.Longitudes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.EnumMap;

/**
 * Builds the personality/design snapshot pair consumed by the gate-based systems. Both
 * snapshots are tropical.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotService {

    private final PlacementEngine placementEngine;
    private final TemporalResolver temporalResolver;
    private final DesignInstantCalculator designInstantCalculator;
    private final EphemerisHealthCheck healthCheck;

    @Retryable(retryFor = ProviderCalculationException.class, maxAttempts = 2, backoff = @Backoff(delay = 200))
    public DualSnapshot computeSnapshots(final BirthMoment birth) {
        healthCheck.ensureReady();
        final var session = placementEngine.openSession();
        final var personalityInstant = temporalResolver.resolve(birth, session).instant();
        final var designInstant = designInstantCalculator.computeDesignInstant(personalityInstant, session);

        final var snapshot = new DualSnapshot(snapshot(personalityInstant, session), snapshot(designInstant, session));
        log.info("[EPHEMERIS] Snapshots personality JD {} design JD {}",
                personalityInstant.julianDay(), designInstant.julianDay());
        return snapshot;
    }

    static LongitudeSnapshot snapshot(final UtInstant instant, final EphemerisSession session) {
        final var longitudes = new EnumMap<ActivationPoint, Double>(ActivationPoint.class);
        for (final var point : ActivationPoint.values()) {
            if (point.body() != null) {
                longitudes.put(point, session.tropical(instant, point.body()).longitude());
            }
        }
        longitudes.put(ActivationPoint.EARTH, Longitudes.opposite(longitudes.get(ActivationPoint.SUN)));
        longitudes.put(ActivationPoint.SOUTH_NODE, Longitudes.opposite(longitudes.get(ActivationPoint.NORTH_NODE)));
        return new LongitudeSnapshot(instant, longitudes);
    }
}
