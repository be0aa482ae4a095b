package io.github.jakubt4.astrolabe.config;

import io.github.jakubt4.astrolabe.ephemeris.OrekitDataPaths;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.orekit.data.DataContext;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the Orekit data (JPL DE ephemerides, leap seconds, Earth orientation parameters)
 * configured at {@code astrolabe.ephemeris.data-path} with Orekit's default {@link DataContext}.
 *
 * <p>Must initialize before any Orekit API call. Other beans that depend on Orekit
 * should inject this configuration to guarantee ordering. A missing data path is logged
 * rather than thrown here: the startup health check turns it into a readiness failure with
 * a clearer diagnosis.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class OrekitConfig {

    private final AstrolabeProperties properties;

    @PostConstruct
    public void init() {
        final var dataPath = properties.getEphemeris().getDataPath();
        if (!OrekitDataPaths.exists(dataPath)) {
            log.error("[EPHEMERIS] Orekit data not found at {}; placements cannot be computed", dataPath);
            return;
        }
        OrekitDataPaths.register(DataContext.getDefault().getDataProvidersManager(), dataPath);
    }
}
