package io.github.jakubt4.astrolabe.health;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.service.EphemerisHealthCheck;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of the startup ephemeris verification. Reports the last outcome; it does not
 * re-run the reference computation.
 */
@Component
@RequiredArgsConstructor
public class EphemerisHealthIndicator implements HealthIndicator {

    private final EphemerisHealthCheck healthCheck;
    private final AstrolabeProperties properties;

    @Override
    public Health health() {
        final var result = healthCheck.lastResult();
        final var builder = result.ready() ? Health.up() : Health.down();
        return builder
                .withDetail("detail", result.detail())
                .withDetail("dataPath", properties.getEphemeris().getDataPath())
                .withDetail("siderealMethod", properties.getEphemeris().getSiderealMethod().displayName())
                .withDetail("houseSystem", properties.getEphemeris().getHouseSystem().name())
                .withDetail("coverageDates", properties.getHealthCheck().getCoverageDates())
                .build();
    }
}
