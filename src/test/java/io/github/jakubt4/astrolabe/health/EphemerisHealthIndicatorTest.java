package io.github.jakubt4.astrolabe.health;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.service.EphemerisHealthCheck;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EphemerisHealthIndicatorTest {

    private final EphemerisHealthCheck healthCheck = mock(EphemerisHealthCheck.class);
    private final EphemerisHealthIndicator indicator = new EphemerisHealthIndicator(healthCheck, new AstrolabeProperties());

    @Test
    void upWhenReferenceVerified() {
        when(healthCheck.lastResult()).thenReturn(new EphemerisHealthCheck.Result(true, "Reference Sun in Capricorn"));

        final var health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("detail", "Reference Sun in Capricorn")
                .containsEntry("siderealMethod", "Lahiri")
                .containsEntry("coverageDates", List.of("1990-01-01", "2039-12-31"));
    }

    @Test
    void downWhenReferenceFailed() {
        when(healthCheck.lastResult()).thenReturn(new EphemerisHealthCheck.Result(false, "Reference computation failed"));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
