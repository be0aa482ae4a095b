package io.github.jakubt4.astrolabe.ephemeris;

import io.github.jakubt4.astrolabe.zodiac.Longitudes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HouseGeometryTest {

    private static final double OBLIQUITY = 23.4392911;

    @Test
    void equatorialAnglesAtZeroRamc() {
        assertThat(HouseGeometry.ascendant(0.0, OBLIQUITY, 0.0)).isCloseTo(90.0, within(1e-9));
        assertThat(HouseGeometry.midheaven(0.0, OBLIQUITY)).isCloseTo(0.0, within(1e-9));
        assertThat(HouseGeometry.ascendant(90.0, OBLIQUITY, 0.0)).isCloseTo(180.0, within(1e-9));
    }

    @ParameterizedTest
    @EnumSource(HouseSystem.class)
    void cuspsRunOnceAroundTheCircle(final HouseSystem system) {
        for (var ramc = 0.0; ramc < 360.0; ramc += 37.0) {
            final var houses = HouseGeometry.compute(system, ramc, OBLIQUITY, 48.15, 0.0);

            var total = 0.0;
            for (var house = 1; house <= 12; house++) {
                final var next = house == 12 ? 1 : house + 1;
                final var span = Longitudes.normalize(houses.cusp(next) - houses.cusp(house));
                assertThat(span).isLessThan(180.0);
                total += span;
            }
            assertThat(total).isCloseTo(360.0, within(1e-6));
        }
    }

    @ParameterizedTest
    @ValueSource(doubles = {66.0, 67.0, 70.0, 75.0, 80.0, 85.0, 89.0, -70.0, -80.0})
    void highLatitudeFramesPartitionTheCircle(final double latitude) {
        for (final var system : HouseSystem.values()) {
            for (var ramc = 0.0; ramc < 360.0; ramc += 5.0) {
                final var houses = HouseGeometry.compute(system, ramc, OBLIQUITY, latitude, 0.0);
                final var frame = system + " lat=" + latitude + " ramc=" + ramc;

                assertThat(Longitudes.normalize(houses.ascendant() - houses.mc()))
                        .as(frame).isLessThanOrEqualTo(180.0);
                var total = 0.0;
                for (var house = 1; house <= 12; house++) {
                    final var next = house == 12 ? 1 : house + 1;
                    final var span = Longitudes.normalize(houses.cusp(next) - houses.cusp(house));
                    assertThat(span).as(frame).isLessThanOrEqualTo(180.0);
                    total += span;
                }
                assertThat(total).as(frame).isCloseTo(360.0, within(1e-6));
            }
        }
    }

    @Test
    void westernHorizonPointIsReplacedByItsOpposite() {
        // at 67 deg north with RAMC 270 the raw formula yields the setting point
        final var raw = HouseGeometry.ascendant(270.0, OBLIQUITY, 67.0);
        assertThat(Longitudes.normalize(raw - HouseGeometry.midheaven(270.0, OBLIQUITY))).isGreaterThan(180.0);

        final var houses = HouseGeometry.compute(HouseSystem.PORPHYRY, 270.0, OBLIQUITY, 67.0, 0.0);

        assertThat(Longitudes.normalize(houses.ascendant() - Longitudes.opposite(raw))).isCloseTo(0.0, within(1e-9));
        assertThat(Longitudes.normalize(houses.ascendant() - houses.mc())).isCloseTo(90.0, within(1e-6));
        assertThat(Longitudes.normalize(houses.cusp(11) - houses.mc())).isCloseTo(30.0, within(1e-6));
        assertThat(Longitudes.normalize(houses.cusp(2) - houses.ascendant())).isCloseTo(30.0, within(1e-6));
    }

    @Test
    void placidusAnglesAreFirstAndTenthCusps() {
        final var houses = HouseGeometry.compute(HouseSystem.PLACIDUS, 123.0, OBLIQUITY, 40.0, 0.0);

        assertThat(houses.cusp(1)).isEqualTo(houses.ascendant());
        assertThat(houses.cusp(10)).isEqualTo(houses.mc());
        assertThat(houses.cusp(7)).isCloseTo(Longitudes.opposite(houses.ascendant()), within(1e-9));
    }

    @Test
    void placidusFallsBackToPorphyryInsidePolarCircle() {
        final var placidus = HouseGeometry.compute(HouseSystem.PLACIDUS, 0.0, OBLIQUITY, 80.0, 0.0);
        final var porphyry = HouseGeometry.compute(HouseSystem.PORPHYRY, 0.0, OBLIQUITY, 80.0, 0.0);

        assertThat(placidus.cusps()).containsExactly(porphyry.cusps());
    }

    @Test
    void wholeSignCuspsStartAtAscendantSign() {
        final var houses = HouseGeometry.compute(HouseSystem.WHOLE_SIGN, 200.0, OBLIQUITY, 48.15, 0.0);
        final var ascendantSignStart = Longitudes.signIndex(houses.ascendant()) * 30.0;

        assertThat(houses.cusp(1)).isEqualTo(ascendantSignStart);
        for (var house = 1; house <= 12; house++) {
            assertThat(houses.cusp(house) % 30.0).isZero();
        }
    }

    @Test
    void shiftMovesEveryLongitude() {
        final var tropical = HouseGeometry.compute(HouseSystem.PORPHYRY, 200.0, OBLIQUITY, 48.15, 0.0);
        final var shifted = HouseGeometry.compute(HouseSystem.PORPHYRY, 200.0, OBLIQUITY, 48.15, 24.0);

        assertThat(shifted.ascendant()).isCloseTo(Longitudes.normalize(tropical.ascendant() - 24.0), within(1e-9));
        assertThat(shifted.mc()).isCloseTo(Longitudes.normalize(tropical.mc() - 24.0), within(1e-9));
        for (var house = 1; house <= 12; house++) {
            assertThat(shifted.cusp(house)).isCloseTo(Longitudes.normalize(tropical.cusp(house) - 24.0), within(1e-9));
        }
    }
}
