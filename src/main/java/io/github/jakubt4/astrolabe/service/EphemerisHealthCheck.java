package io.github.jakubt4.astrolabe.service;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.ephemeris.EphemerisBody;
import io.github.jakubt4.astrolabe.model.BirthMoment;
import io.github.jakubt4.astrolabe.model.UtInstant;
import io.github.jakubt4.astrolabe.zodiac.ZodiacSign;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Startup verification of the ephemeris: the tropical Sun of the J2000.0 reference moment must
 * fall in Capricorn, and the Sun must be computable at every date of
 * {@code astrolabe.health-check.coverage-dates}. Until both have passed, {@link #ensureReady()}
 * rejects computations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EphemerisHealthCheck {

    static final BirthMoment REFERENCE = new BirthMoment("2000-01-01", "12:00", "UTC", 0.0, 0.0);
    static final ZodiacSign EXPECTED_SUN_SIGN = ZodiacSign.CAPRICORN;

    private final PlacementEngine placementEngine;
    private final AstrolabeProperties properties;

    private final AtomicReference<Result> result = new AtomicReference<>(Result.notRun());

    @EventListener(ApplicationStartedEvent.class)
    public void onStartup() {
        final var outcome = verify();
        if (!outcome.ready() && properties.getHealthCheck().isFailFast()) {
            throw new EphemerisConfigurationException(outcome.detail());
        }
    }

    /**
     * Runs the reference and coverage computations and records the outcome.
     */
    public Result verify() {
        Result outcome;
        try {
            final var sunSign = placementEngine.compute(REFERENCE).tropical().sun().sign();
            if (sunSign == EXPECTED_SUN_SIGN) {
                outcome = coverage("Reference Sun in " + sunSign.displayName());
            } else {
                outcome = new Result(false, "Reference Sun in " + sunSign.displayName() + ", expected "
                        + EXPECTED_SUN_SIGN.displayName() + "; ephemeris data misconfigured");
            }
        } catch (final RuntimeException e) {
            outcome = new Result(false, "Reference computation failed: " + e.getMessage());
            log.error("[HEALTH] {}", outcome.detail(), e);
            result.set(outcome);
            return outcome;
        }
        if (outcome.ready()) {
            log.info("[HEALTH] Ephemeris verified: {}", outcome.detail());
        } else {
            log.error("[HEALTH] {}", outcome.detail());
        }
        result.set(outcome);
        return outcome;
    }

    private Result coverage(final String referenceDetail) {
        final List<String> dates = properties.getHealthCheck().getCoverageDates();
        if (dates.isEmpty()) {
            return new Result(true, referenceDetail);
        }
        final var session = placementEngine.openSession();
        for (final var text : dates) {
            try {
                final var date = LocalDate.parse(text);
                final var instant = new UtInstant(session.julianDay(
                        date.getYear(), date.getMonthValue(), date.getDayOfMonth(), 12.0));
                session.tropical(instant, EphemerisBody.SUN);
                log.debug("[HEALTH] Ephemeris covers {}", date);
            } catch (final RuntimeException e) {
                return new Result(false, referenceDetail + "; ephemeris does not cover " + text + ": "
                        + e.getMessage());
            }
        }
        return new Result(true, referenceDetail + "; covers " + String.join(", ", dates));
    }

    public Result lastResult() {
        return result.get();
    }

    public void ensureReady() {
        final var current = result.get();
        if (!current.ready()) {
            throw new EphemerisConfigurationException("Ephemeris not ready: " + current.detail());
        }
    }

    /**
     * @param ready  whether the last reference computation reproduced the expected sign and
     *               every coverage date could be computed
     * @param detail human-readable outcome
     */
    public record Result(boolean ready, String detail) {

        static Result notRun() {
            return new Result(false, "Reference computation has not run");
        }
    }
}
