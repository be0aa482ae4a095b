package io.github.jakubt4.astrolabe.ephemeris;

import io.github.jakubt4.astrolabe.model.UtInstant;
import io.github.jakubt4.astrolabe.zodiac.Longitudes;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EphemerisSessionTest {

    private final FakeEphemerisProvider provider = new FakeEphemerisProvider();
    private final EphemerisSession session = new EphemerisSession(provider, SiderealMethod.LAHIRI);

    @Test
    void tropicalCallAfterSiderealCallIsNotShifted() {
        final var instant = UtInstant.J2000;

        final var sidereal = session.sidereal(instant, EphemerisBody.SUN);
        final var tropical = session.tropical(instant, EphemerisBody.SUN);

        assertThat(provider.getCoordinateMode()).isEqualTo(CoordinateMode.TROPICAL);
        assertThat(tropical.longitude()).isEqualTo(FakeEphemerisProvider.tropicalLongitude(EphemerisBody.SUN, instant));
        assertThat(sidereal.longitude()).isCloseTo(
                Longitudes.normalize(tropical.longitude() - session.correctionAngle(instant)), within(1e-9));
    }

    @Test
    void correctionAngleIsAvailableWhateverTheProviderWasLeftIn() {
        provider.setCoordinateMode(CoordinateMode.TROPICAL);

        assertThat(session.correctionAngle(UtInstant.J2000)).isCloseTo(23.857, within(0.001));
        assertThat(provider.getCoordinateMode()).isEqualTo(CoordinateMode.sidereal(SiderealMethod.LAHIRI));
    }

    @Test
    void housesFollowTheRequestedMode() {
        final var tropical = session.tropicalHouses(UtInstant.J2000, 48.15, 17.11, HouseSystem.WHOLE_SIGN);
        final var sidereal = session.siderealHouses(UtInstant.J2000, 48.15, 17.11, HouseSystem.WHOLE_SIGN);

        assertThat(sidereal.ascendant()).isCloseTo(
                Longitudes.normalize(tropical.ascendant() - session.correctionAngle(UtInstant.J2000)), within(1e-9));
        assertThat(provider.calls()).containsExactly("HOUSES:W:TROPICAL", "HOUSES:W:SIDEREAL");
    }
}
