package io.github.jakubt4.astrolabe.zodiac;

import org.junit.jupiter.api.Test;

import java.util.HashSet;

import static org.assertj.core.api.Assertions.assertThat;

class GateWheelTest {

    @Test
    void sequenceIsAPermutationOfSixtyFourGates() {
        final var sequence = GateWheel.sequence();

        assertThat(sequence).hasSize(64);
        assertThat(new HashSet<>(sequence)).hasSize(64);
        assertThat(sequence).allMatch(gate -> gate >= 1 && gate <= 64);
    }

    @Test
    void gateAtWheelEndsMatchesTableEnds() {
        assertThat(GateWheel.gateOf(0.0)).isEqualTo(41);
        assertThat(GateWheel.gateOf(359.999)).isEqualTo(60);
        assertThat(GateWheel.gateOf(360.0)).isEqualTo(41);
        assertThat(GateWheel.gateOf(5.625)).isEqualTo(19);
    }

    @Test
    void linesDivideEachGateIntoSix() {
        assertThat(GateWheel.lineOf(0.0)).isEqualTo(1);
        assertThat(GateWheel.lineOf(0.9375)).isEqualTo(2);
        assertThat(GateWheel.lineOf(5.6)).isEqualTo(6);
    }

    @Test
    void eclipticActivationStartsAtTwoDegreesAquarius() {
        assertThat(GateWheel.activation(302.0)).isEqualTo(new GateWheel.Activation(41, 1));
        assertThat(GateWheel.activation(301.99)).isEqualTo(new GateWheel.Activation(60, 6));
        // 0° Aries is 58° along the wheel: sector 10, gate 25
        assertThat(GateWheel.activation(0.0).gate()).isEqualTo(25);
    }
}
