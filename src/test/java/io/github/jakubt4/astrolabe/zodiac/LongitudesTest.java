package io.github.jakubt4.astrolabe.zodiac;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LongitudesTest {

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -0.0, 359.999999, 360.0, 720.5, -1e-15, -30.0, -725.25, 1e9})
    void normalizeLandsInRangeAndIsIdempotent(final double input) {
        final var once = Longitudes.normalize(input);

        assertThat(once).isGreaterThanOrEqualTo(0.0).isLessThan(360.0);
        assertThat(Longitudes.normalize(once)).isEqualTo(once);
    }

    @Test
    void normalizeFoldsNegativeAndFullTurns() {
        assertThat(Longitudes.normalize(-30.0)).isEqualTo(330.0);
        assertThat(Longitudes.normalize(360.0)).isEqualTo(0.0);
        assertThat(Longitudes.normalize(725.25)).isCloseTo(5.25, within(1e-9));
    }

    @ParameterizedTest
    @CsvSource({
            "0.0, 1",
            "9.999, 1",
            "10.0, 2",
            "19.999, 2",
            "20.0, 3",
            "29.999, 3"
    })
    void decanBoundaries(final double degreeInSign, final int expected) {
        assertThat(Longitudes.decan(degreeInSign)).isEqualTo(expected);
    }

    @Test
    void positionDecomposesIntoSignDegreeAndMinute() {
        final var position = Longitudes.position(280.5);

        assertThat(position.sign()).isEqualTo(ZodiacSign.CAPRICORN);
        assertThat(position.degree()).isEqualTo(10);
        assertThat(position.minute()).isEqualTo(30);
        assertThat(position.decan()).isEqualTo(2);
    }

    @Test
    void houseStraddlingZeroContainsLongitudesOnBothSides() {
        assertThat(Longitudes.inSpan(355.0, 350.0, 10.0)).isTrue();
        assertThat(Longitudes.inSpan(5.0, 350.0, 10.0)).isTrue();
        assertThat(Longitudes.inSpan(350.0, 350.0, 10.0)).isTrue();
        assertThat(Longitudes.inSpan(10.0, 350.0, 10.0)).isFalse();
        assertThat(Longitudes.inSpan(180.0, 350.0, 10.0)).isFalse();
    }

    @Test
    void houseOfFindsStraddlingHouse() {
        final var cusps = new double[13];
        for (var house = 1; house <= 12; house++) {
            cusps[house] = Longitudes.normalize(350.0 + 30.0 * (house - 1));
        }

        assertThat(Longitudes.houseOf(355.0, cusps)).hasValue(1);
        assertThat(Longitudes.houseOf(5.0, cusps)).hasValue(1);
        assertThat(Longitudes.houseOf(20.0, cusps)).hasValue(2);
        assertThat(Longitudes.houseOf(349.0, cusps)).hasValue(12);
    }

    @Test
    void wholeSignHouseCyclesThroughTwelve() {
        final var ascendant = 95.0; // Cancer
        for (var sign = 0; sign < 12; sign++) {
            final var body = sign * 30.0 + 15.0;
            final var expected = Math.floorMod(sign - 3, 12) + 1;
            assertThat(Longitudes.wholeSignHouse(body, ascendant)).isEqualTo(expected);
        }
    }

    @Test
    void lunarSectorsHaveTwentySevenBinsOfFourQuarters() {
        final var span = 360.0 / 27;
        final var quarter = 360.0 / 108;
        for (var sector = 0; sector < 27; sector++) {
            for (var q = 0; q < 4; q++) {
                final var start = sector * span + q * quarter;
                final var middle = start + quarter / 2;
                assertThat(Longitudes.nakshatraIndex(middle)).isEqualTo(sector);
                assertThat(Longitudes.pada(middle)).isEqualTo(q + 1);
            }
        }
    }

    @Test
    void lunarSectorBoundaries() {
        assertThat(Longitudes.nakshatraIndex(0.0)).isZero();
        assertThat(Longitudes.pada(0.0)).isEqualTo(1);
        assertThat(Longitudes.nakshatraIndex(13.0 + 1.0 / 3.0 + 1e-9)).isEqualTo(1);
        assertThat(Longitudes.nakshatraIndex(359.9999)).isEqualTo(26);
        assertThat(Longitudes.pada(359.9999)).isEqualTo(4);
        assertThat(Longitudes.nakshatraIndex(360.0)).isZero();
    }

    @Test
    void angularDistanceIsShortestArc() {
        assertThat(Longitudes.angularDistance(350.0, 10.0)).isCloseTo(20.0, within(1e-9));
        assertThat(Longitudes.angularDistance(0.0, 180.0)).isCloseTo(180.0, within(1e-9));
    }
}
