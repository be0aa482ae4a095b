package io.github.jakubt4.astrolabe.derived;

import io.github.jakubt4.astrolabe.zodiac.GateWheel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the activation, relationship and pearl sequences off the gate wheel. Only gate and
 * line numbers are produced; what each gate means belongs to the consuming system.
 */
@Component
public class ActivationSequence implements GateActivationAdapter {

    @Override
    public List<NamedActivation> activations(final DualSnapshot snapshot) {
        final var personality = snapshot.personality();
        final var design = snapshot.design();
        final var result = new ArrayList<NamedActivation>(11);
        result.add(read("lifesWork", personality, ActivationPoint.SUN));
        result.add(read("evolution", personality, ActivationPoint.EARTH));
        result.add(read("radiance", design, ActivationPoint.SUN));
        result.add(read("purpose", design, ActivationPoint.EARTH));
        result.add(read("attraction", personality, ActivationPoint.VENUS));
        result.add(read("iq", design, ActivationPoint.MARS));
        result.add(read("eq", design, ActivationPoint.VENUS));
        result.add(read("sq", personality, ActivationPoint.MOON));
        result.add(read("vocation", personality, ActivationPoint.MARS));
        result.add(read("culture", design, ActivationPoint.JUPITER));
        // same sphere as lifesWork
        result.add(read("pearl", personality, ActivationPoint.SUN));
        return List.copyOf(result);
    }

    private static NamedActivation read(final String name, final LongitudeSnapshot snapshot,
                                        final ActivationPoint point) {
        final GateWheel.Activation activation = snapshot.activation(point);
        return new NamedActivation(name, point, activation.gate(), activation.line());
    }
}
