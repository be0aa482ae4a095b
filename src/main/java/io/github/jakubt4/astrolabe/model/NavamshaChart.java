package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.zodiac.Graha;
import io.github.jakubt4.astrolabe.zodiac.ZodiacSign;

import java.util.List;

/**
 * Ninth-harmonic (D-9) signs of the sidereal ascendant and the mean-node grahas.
 */
public record NavamshaChart(ZodiacSign lagnaSign, List<Entry> grahas) {

    public record Entry(Graha graha, ZodiacSign navamshaSign) {
    }
}
