package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.zodiac.AspectType;

/**
 * Major aspect between two chart points.
 *
 * @param orb   deviation from the exact angle, degrees rounded to two decimals
 * @param exact {@code true} when the orb is at most one degree
 */
public record Aspect(String a, String b, AspectType type, double orb, boolean exact) {
}
