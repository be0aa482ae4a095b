package io.github.jakubt4.astrolabe.service;

import io.github.jakubt4.astrolabe.model.UtInstant;

import java.time.ZonedDateTime;

/**
 * A validated birth moment: the wall-clock time in its zone and the absolute instant.
 */
public record ResolvedMoment(ZonedDateTime localTime, UtInstant instant) {
}
