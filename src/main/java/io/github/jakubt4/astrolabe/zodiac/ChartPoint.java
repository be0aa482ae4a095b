package io.github.jakubt4.astrolabe.zodiac;

/**
 * A named longitude taking part in aspect detection, e.g. {@code SUN} or {@code ASC}.
 */
public record ChartPoint(String name, double longitude) {
}
