package io.github.jakubt4.astrolabe.derived;

import io.github.jakubt4.astrolabe.model.BirthMoment;

/**
 * Name and date numerology. Takes the raw birth moment, not a snapshot.
 *
 * @param <R> reading type of the implementation
 */
@FunctionalInterface
public interface NumerologyAdapter<R> {

    R reading(String fullName, BirthMoment birth);
}
