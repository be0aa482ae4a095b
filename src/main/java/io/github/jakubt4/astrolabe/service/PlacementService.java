package io.github.jakubt4.astrolabe.service;

import io.github.jakubt4.astrolabe.ephemeris.ProviderCalculationException;
import io.github.jakubt4.astrolabe.model.BirthMoment;
import io.github.jakubt4.astrolabe.model.PlacementAggregate;
import lombok.RequiredArgsConstructor;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * Entry point for placement requests. Refuses work until the ephemeris has been verified and
 * retries a failed provider computation once on a fresh provider.
 */
@Service
@RequiredArgsConstructor
public class PlacementService {

    private final PlacementEngine placementEngine;
    private final EphemerisHealthCheck healthCheck;

    @Retryable(retryFor = ProviderCalculationException.class, maxAttempts = 2, backoff = @Backoff(delay = 200))
    public PlacementAggregate computePlacements(final BirthMoment birth) {
        healthCheck.ensureReady();
        return placementEngine.compute(birth);
    }
}
