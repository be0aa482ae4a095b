package io.github.jakubt4.astrolabe.ephemeris;

/**
 * Creates isolated provider instances, one per computation.
 */
@FunctionalInterface
public interface EphemerisProviderFactory {

    EphemerisProvider create();
}
