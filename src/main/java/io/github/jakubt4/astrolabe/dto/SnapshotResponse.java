package io.github.jakubt4.astrolabe.dto;

import io.github.jakubt4.astrolabe.derived.DualSnapshot;
import io.github.jakubt4.astrolabe.derived.GateActivationAdapter.NamedActivation;

import java.util.List;

/**
 * Dual snapshot plus the activation sequence read from it.
 *
 * @param designOffsetDays days between the design and personality instants
 */
public record SnapshotResponse(DualSnapshot snapshot, double designOffsetDays, List<NamedActivation> activations) {
}
