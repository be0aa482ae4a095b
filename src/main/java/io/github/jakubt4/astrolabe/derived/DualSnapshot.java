package io.github.jakubt4.astrolabe.derived;

/**
 * Personality (birth) and design snapshots handed to the derived systems.
 */
public record DualSnapshot(LongitudeSnapshot personality, LongitudeSnapshot design) {
}
