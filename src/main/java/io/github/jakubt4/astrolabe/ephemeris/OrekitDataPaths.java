package io.github.jakubt4.astrolabe.ephemeris;

import lombok.extern.slf4j.Slf4j;
import org.orekit.data.DataProvider;
import org.orekit.data.DataProvidersManager;
import org.orekit.data.DirectoryCrawler;
import org.orekit.data.ZipJarCrawler;

import java.io.File;

/**
 * Resolves an ephemeris data path into an Orekit {@link DataProvider}.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>{@code classpath:orekit-data.zip}: an archive on the classpath</li>
 *   <li>{@code /opt/orekit-data.zip}: an archive on the file system</li>
 *   <li>{@code /opt/orekit-data}: an unpacked data directory</li>
 * </ul>
 */
@Slf4j
public final class OrekitDataPaths {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private OrekitDataPaths() {
    }

    /**
     * Replaces the providers of a manager with the crawler for {@code path}.
     *
     * @throws IllegalArgumentException if nothing exists at {@code path}
     */
    public static void register(final DataProvidersManager manager, final String path) {
        final var crawler = crawlerFor(path);
        manager.clearProviders();
        manager.clearLoadedDataNames();
        manager.addProvider(crawler);
        log.info("[EPHEMERIS] Data path set to {}", path);
    }

    /**
     * Whether {@code path} points at something a crawler could read.
     */
    public static boolean exists(final String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return OrekitDataPaths.class.getClassLoader()
                    .getResource(path.substring(CLASSPATH_PREFIX.length())) != null;
        }
        return new File(path).exists();
    }

    static DataProvider crawlerFor(final String path) {
        if (!exists(path)) {
            throw new IllegalArgumentException("Ephemeris data not found at " + path);
        }
        if (path.startsWith(CLASSPATH_PREFIX)) {
            final var resource = OrekitDataPaths.class.getClassLoader()
                    .getResource(path.substring(CLASSPATH_PREFIX.length()));
            return new ZipJarCrawler(resource);
        }
        final var file = new File(path);
        return file.isDirectory() ? new DirectoryCrawler(file) : new ZipJarCrawler(file);
    }
}
