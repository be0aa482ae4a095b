package io.github.jakubt4.astrolabe.ephemeris;

/**
 * Calendar date to Julian Day conversion (Meeus, <i>Astronomical Algorithms</i>, ch. 7).
 */
public final class JulianDays {

    private JulianDays() {
    }

    public static double of(final int year, final int month, final int day, final double hour,
                            final CalendarType calendar) {
        var y = year;
        var m = month;
        if (m <= 2) {
            y -= 1;
            m += 12;
        }
        var b = 0.0;
        if (calendar == CalendarType.GREGORIAN) {
            final var a = Math.floor(y / 100.0);
            b = 2 - a + Math.floor(a / 4.0);
        }
        return Math.floor(365.25 * (y + 4716)) + Math.floor(30.6001 * (m + 1)) + day + b - 1524.5
                + hour / 24.0;
    }
}
