package io.github.jakubt4.astrolabe.model;

/**
 * Tropical mean lunar node axis. The south node is always opposite the north node.
 *
 * @param retrograde {@code true} when the node moves backwards, which the mean node always does
 */
public record NodeAxis(double northNodeLongitude,
                       double southNodeLongitude,
                       int northNodeHouse,
                       int southNodeHouse,
                       boolean retrograde) {
}
