package io.github.jakubt4.astrolabe.zodiac;

import io.github.jakubt4.astrolabe.model.DashaPeriod;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Vimshottari dasha timeline: the 120-year cycle of nine planetary periods that starts with the
 * lord of the Moon's birth nakshatra.
 *
 * <p>The first mahadasha is shortened by the fraction of the nakshatra the Moon had already
 * covered at birth. Its antardashas are laid out over the full period and those ending before
 * birth are dropped. Years are 365.25 days.
 */
public final class VimshottariDasha {

    public static final double CYCLE_YEARS = 120.0;
    private static final double SECONDS_PER_YEAR = 365.25 * 86400.0;

    private static final List<Graha> ORDER = List.of(
            Graha.KETU, Graha.VENUS, Graha.SUN, Graha.MOON, Graha.MARS,
            Graha.RAHU, Graha.JUPITER, Graha.SATURN, Graha.MERCURY);

    private static final Map<Graha, Integer> YEARS = new EnumMap<>(Map.of(
            Graha.KETU, 7, Graha.VENUS, 20, Graha.SUN, 6, Graha.MOON, 10, Graha.MARS, 7,
            Graha.RAHU, 18, Graha.JUPITER, 16, Graha.SATURN, 19, Graha.MERCURY, 17));

    private VimshottariDasha() {
    }

    public static int yearsOf(final Graha lord) {
        return YEARS.get(lord);
    }

    /**
     * Nine mahadashas from birth, each with its antardashas.
     *
     * @param moonSiderealLongitude sidereal longitude of the Moon at birth
     * @param birth                 birth moment in the birth timezone; period dates are local to it
     */
    public static List<DashaPeriod> timeline(final double moonSiderealLongitude, final ZonedDateTime birth) {
        final var nakshatra = Nakshatra.of(moonSiderealLongitude);
        final var elapsedFraction = (Longitudes.normalize(moonSiderealLongitude) % Longitudes.NAKSHATRA_SPAN)
                / Longitudes.NAKSHATRA_SPAN;
        final var firstIndex = ORDER.indexOf(nakshatra.lord());

        final var periods = new ArrayList<DashaPeriod>(ORDER.size());
        final var firstLord = ORDER.get(firstIndex);
        final var firstYears = yearsOf(firstLord);
        final var theoreticalStart = plusYears(birth, -elapsedFraction * firstYears);
        var cursor = plusYears(theoreticalStart, firstYears);
        periods.add(new DashaPeriod(firstLord, firstYears, birth.toLocalDate(), cursor.toLocalDate(),
                antardashas(firstLord, theoreticalStart, birth)));

        for (var i = 1; i < ORDER.size(); i++) {
            final var lord = ORDER.get((firstIndex + i) % ORDER.size());
            final var end = plusYears(cursor, yearsOf(lord));
            periods.add(new DashaPeriod(lord, yearsOf(lord), cursor.toLocalDate(), end.toLocalDate(),
                    antardashas(lord, cursor, cursor)));
            cursor = end;
        }
        return List.copyOf(periods);
    }

    /**
     * Sub-periods of a mahadasha starting at {@code start}; sub-periods ending at or before
     * {@code notBefore} are skipped and the first kept one is clipped to it.
     */
    private static List<DashaPeriod> antardashas(final Graha mahadashaLord, final ZonedDateTime start,
                                                 final ZonedDateTime notBefore) {
        final var result = new ArrayList<DashaPeriod>(ORDER.size());
        final var mahaIndex = ORDER.indexOf(mahadashaLord);
        var cursor = start;
        for (var i = 0; i < ORDER.size(); i++) {
            final var lord = ORDER.get((mahaIndex + i) % ORDER.size());
            final var years = yearsOf(mahadashaLord) * yearsOf(lord) / CYCLE_YEARS;
            final var end = plusYears(cursor, years);
            if (end.isAfter(notBefore)) {
                final var from = cursor.isBefore(notBefore) ? notBefore : cursor;
                result.add(new DashaPeriod(lord, years, from.toLocalDate(), end.toLocalDate(), List.of()));
            }
            cursor = end;
        }
        return List.copyOf(result);
    }

    private static ZonedDateTime plusYears(final ZonedDateTime from, final double years) {
        return from.plusSeconds(Math.round(years * SECONDS_PER_YEAR));
    }
}
