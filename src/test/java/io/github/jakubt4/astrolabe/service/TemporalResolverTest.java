package io.github.jakubt4.astrolabe.service;

import io.github.jakubt4.astrolabe.ephemeris.EphemerisSession;
import io.github.jakubt4.astrolabe.ephemeris.FakeEphemerisProvider;
import io.github.jakubt4.astrolabe.ephemeris.SiderealMethod;
import io.github.jakubt4.astrolabe.model.BirthMoment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TemporalResolverTest {

    private final TemporalResolver resolver = new TemporalResolver();
    private final EphemerisSession session = new EphemerisSession(new FakeEphemerisProvider(), SiderealMethod.LAHIRI);

    @Test
    void utcNoonOfJ2000() {
        final var resolved = resolver.resolve(new BirthMoment("2000-01-01", "12:00", "UTC", 0.0, 0.0), session);

        assertThat(resolved.instant().julianDay()).isEqualTo(2451545.0);
    }

    @ParameterizedTest
    @CsvSource({
            "2000-01-01, 13:00, Europe/Bratislava",
            "2000-01-01, 07:00, America/New_York",
            "2000-01-01, 21:00, Asia/Tokyo",
            "2000-01-01, 17:30, Asia/Kolkata",
            "2000-01-01, 12:00:00, Etc/UTC"
    })
    void sameInstantInDifferentZonesGivesIdenticalDayNumber(final String date, final String time, final String zone) {
        final var resolved = resolver.resolve(new BirthMoment(date, time, zone, 10.0, 10.0), session);

        assertThat(resolved.instant().julianDay()).isEqualTo(2451545.0);
    }

    @Test
    void secondsContributeToTheFraction() {
        final var resolved = resolver.resolve(new BirthMoment("2000-01-01", "12:00:36", "UTC", 0.0, 0.0), session);

        assertThat(resolved.instant().julianDay()).isCloseTo(2451545.0 + 36.0 / 86400.0, within(1e-9));
    }

    @Test
    void historicalOffsetIsApplied() {
        // Bratislava observed summer time (UTC+2) in June 1990
        final var resolved = resolver.resolve(Engines.BRATISLAVA, session);

        assertThat(resolved.localTime().getOffset()).isEqualTo(ZoneOffset.ofHours(2));
        assertThat(resolved.localTime().getHour()).isEqualTo(14);
    }

    @Test
    void springForwardGapIsRejected() {
        final var birth = new BirthMoment("2021-03-28", "02:30", "Europe/Bratislava", 48.15, 17.11);

        assertThatThrownBy(() -> resolver.resolve(birth, session))
                .isInstanceOf(InvalidBirthMomentException.class)
                .hasMessageContaining("daylight-saving gap");
    }

    @Test
    void autumnOverlapTakesEarlierOffset() {
        final var resolved = resolver.resolve(
                new BirthMoment("2021-10-31", "02:30", "Europe/Bratislava", 48.15, 17.11), session);

        assertThat(resolved.localTime().getOffset()).isEqualTo(ZoneOffset.ofHours(2));
    }

    @Test
    void malformedInputIsRejected() {
        assertThatThrownBy(() -> resolver.resolve(new BirthMoment("2000-13-01", "12:00", "UTC", 0, 0), session))
                .isInstanceOf(InvalidBirthMomentException.class);
        assertThatThrownBy(() -> resolver.resolve(new BirthMoment("2000-01-01", "25:00", "UTC", 0, 0), session))
                .isInstanceOf(InvalidBirthMomentException.class);
        assertThatThrownBy(() -> resolver.resolve(new BirthMoment("2000-01-01", "12:00", "Mars/Olympus", 0, 0), session))
                .isInstanceOf(InvalidBirthMomentException.class)
                .hasMessageContaining("Unknown timezone");
        assertThatThrownBy(() -> resolver.resolve(new BirthMoment("2000-01-01", null, "UTC", 0, 0), session))
                .isInstanceOf(InvalidBirthMomentException.class);
    }

    @Test
    void coordinatesOutOfRangeAreRejected() {
        assertThatThrownBy(() -> resolver.resolve(new BirthMoment("2000-01-01", "12:00", "UTC", 91.0, 0), session))
                .isInstanceOf(InvalidBirthMomentException.class)
                .hasMessageContaining("Latitude");
        assertThatThrownBy(() -> resolver.resolve(new BirthMoment("2000-01-01", "12:00", "UTC", 0, -180.5), session))
                .isInstanceOf(InvalidBirthMomentException.class)
                .hasMessageContaining("Longitude");
        assertThatThrownBy(() -> resolver.resolve(new BirthMoment("2000-01-01", "12:00", "UTC", Double.NaN, 0), session))
                .isInstanceOf(InvalidBirthMomentException.class);
    }
}
