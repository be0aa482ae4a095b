package io.github.jakubt4.astrolabe.ephemeris;

import io.github.jakubt4.astrolabe.config.OrekitConfig;
import lombok.RequiredArgsConstructor;
import org.orekit.data.DataContext;
import org.springframework.stereotype.Component;

/**
 * Hands out a fresh {@link OrekitEphemerisProvider} per computation. All instances share the
 * default Orekit data context, which is read-only once loaded; only the coordinate mode is
 * per instance.
 */
@Component
@RequiredArgsConstructor
public class OrekitEphemerisProviderFactory implements EphemerisProviderFactory {

    @SuppressWarnings("unused") // injected to guarantee Orekit data is registered before first use
    private final OrekitConfig orekitConfig;

    @Override
    public EphemerisProvider create() {
        return new OrekitEphemerisProvider(DataContext.getDefault());
    }
}
