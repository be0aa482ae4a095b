package io.github.jakubt4.astrolabe.dto;

/**
 * Gate wheel reading of a tropical longitude.
 *
 * @param longitude normalized ecliptic longitude the reading was taken at
 * @param gate      gate number, 1..64
 * @param line      line within the gate, 1..6
 */
public record GateResponse(double longitude, int gate, int line) {
}
