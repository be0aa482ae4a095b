package io.github.jakubt4.astrolabe.derived;

import java.util.List;

/**
 * Sequence-style system: names a fixed set of activations (for example the Sun and Earth of
 * both snapshots) read through the shared gate wheel.
 */
@FunctionalInterface
public interface GateActivationAdapter {

    List<NamedActivation> activations(DualSnapshot snapshot);

    /**
     * @param name  role of the activation within the sequence
     * @param point snapshot point it is read from
     * @param gate  gate number, 1..64
     * @param line  line within the gate, 1..6
     */
    record NamedActivation(String name, ActivationPoint point, int gate, int line) {
    }
}
