package io.github.jakubt4.astrolabe.config;

import io.github.jakubt4.astrolabe.ephemeris.HouseSystem;
import io.github.jakubt4.astrolabe.ephemeris.SiderealMethod;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the placement engine.
 * <p>
 * Groups:
 * <ul>
 *     <li>{@code astrolabe.ephemeris} — data path, sidereal method, tropical house system</li>
 *     <li>{@code astrolabe.design} — how the design instant of the dual snapshot is derived</li>
 *     <li>{@code astrolabe.aspects} — orb for major aspects</li>
 *     <li>{@code astrolabe.health-check} — startup gating</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "astrolabe")
public class AstrolabeProperties {

    private final Ephemeris ephemeris = new Ephemeris();
    private final Design design = new Design();
    private final Aspects aspects = new Aspects();
    private final HealthCheck healthCheck = new HealthCheck();

    @Data
    public static class Ephemeris {
        /** classpath:..., a zip archive or an unpacked Orekit data directory */
        @NotBlank
        private String dataPath = "classpath:orekit-data.zip";

        @NotNull
        private SiderealMethod siderealMethod = SiderealMethod.LAHIRI;

        @NotNull
        private HouseSystem houseSystem = HouseSystem.PLACIDUS;
    }

    @Data
    public static class Design {
        @NotNull
        private DesignStrategy strategy = DesignStrategy.FIXED_DAYS;

        /** Days before birth for FIXED_DAYS; solar arc in degrees for SOLAR_ARC. */
        @Positive
        private double offset = 88.0;
    }

    public enum DesignStrategy {
        /** Birth instant minus a fixed number of days. */
        FIXED_DAYS,
        /** Moment the Sun stood a fixed arc behind its birth longitude. */
        SOLAR_ARC
    }

    @Data
    public static class Aspects {
        @DecimalMin("0.0")
        @DecimalMax("15.0")
        private double orb = 5.0;
    }

    @Data
    public static class HealthCheck {
        /** Refuse to start when the reference computation fails. */
        private boolean failFast = true;
        /** ISO dates at the edges of the birth range the ephemeris data must cover. */
        private List<String> coverageDates = new ArrayList<>(List.of("1990-01-01", "2039-12-31"));
    }
}
