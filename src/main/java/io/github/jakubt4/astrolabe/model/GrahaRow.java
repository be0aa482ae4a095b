package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.zodiac.Graha;
import io.github.jakubt4.astrolabe.zodiac.Nakshatra;
import io.github.jakubt4.astrolabe.zodiac.ZodiacSign;

/**
 * One sidereal body row.
 *
 * @param bhava    whole-sign house counted from the sidereal ascendant's sign, 1..12
 * @param trueNode {@code true} for the Rahu/Ketu rows computed from the true (osculating) node
 */
public record GrahaRow(Graha graha,
                       double longitude,
                       ZodiacSign sign,
                       int degree,
                       int minute,
                       int bhava,
                       Nakshatra nakshatra,
                       int pada,
                       boolean trueNode) {
}
