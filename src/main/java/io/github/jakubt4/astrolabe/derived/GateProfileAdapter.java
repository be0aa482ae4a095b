package io.github.jakubt4.astrolabe.derived;

/**
 * Bodygraph-style system: reads the gate and line of every point in both snapshots and builds
 * the profile from them. Implementations live outside this service.
 *
 * @param <P> profile type of the implementation
 */
@FunctionalInterface
public interface GateProfileAdapter<P> {

    P profile(DualSnapshot snapshot);
}
