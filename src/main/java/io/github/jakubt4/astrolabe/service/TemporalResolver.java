package io.github.jakubt4.astrolabe.service;

import io.github.jakubt4.astrolabe.ephemeris.EphemerisSession;
import io.github.jakubt4.astrolabe.model.BirthMoment;
import io.github.jakubt4.astrolabe.model.UtInstant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Turns a birth date, wall-clock time and zone id into a Julian Day (UT).
 *
 * <p>The zone's historical rules decide the offset. A wall-clock time inside a daylight-saving
 * gap is rejected; one inside an overlap takes the earlier offset, which is what
 * {@link ZonedDateTime#of(LocalDateTime, ZoneId)} picks.
 */
@Slf4j
@Component
public class TemporalResolver {

    private static final double SECONDS_PER_HOUR = 3600.0;

    public ResolvedMoment resolve(final BirthMoment birth, final EphemerisSession session) {
        validateCoordinates(birth);
        final var local = parseLocal(birth);
        final var zone = parseZone(birth.timezone());

        if (zone.getRules().getValidOffsets(local).isEmpty()) {
            throw new InvalidBirthMomentException(
                    "Local time " + local + " does not exist in " + zone + " (daylight-saving gap)");
        }
        final var zoned = ZonedDateTime.of(local, zone);
        final var utc = zoned.withZoneSameInstant(ZoneOffset.UTC);
        final var fractionalHour = utc.getHour()
                + utc.getMinute() / 60.0
                + (utc.getSecond() + utc.getNano() / 1e9) / SECONDS_PER_HOUR;

        final var julianDay = session.julianDay(utc.getYear(), utc.getMonthValue(), utc.getDayOfMonth(),
                fractionalHour);
        log.debug("Resolved {} {} {} -> JD {}", birth.date(), birth.time(), zone, julianDay);
        return new ResolvedMoment(zoned, new UtInstant(julianDay));
    }

    private static LocalDateTime parseLocal(final BirthMoment birth) {
        if (birth.date() == null || birth.time() == null) {
            throw new InvalidBirthMomentException("Birth date and time are required");
        }
        try {
            return LocalDateTime.of(LocalDate.parse(birth.date().trim()), LocalTime.parse(birth.time().trim()));
        } catch (final DateTimeException e) {
            throw new InvalidBirthMomentException(
                    "Invalid birth date/time: " + birth.date() + " " + birth.time(), e);
        }
    }

    private static ZoneId parseZone(final String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new InvalidBirthMomentException("Timezone is required");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (final DateTimeException e) {
            throw new InvalidBirthMomentException("Unknown timezone: " + timezone, e);
        }
    }

    private static void validateCoordinates(final BirthMoment birth) {
        if (!(birth.latitude() >= -90.0 && birth.latitude() <= 90.0)) {
            throw new InvalidBirthMomentException("Latitude out of range [-90, 90]: " + birth.latitude());
        }
        if (!(birth.longitude() >= -180.0 && birth.longitude() <= 180.0)) {
            throw new InvalidBirthMomentException("Longitude out of range [-180, 180]: " + birth.longitude());
        }
    }
}
