package io.github.jakubt4.astrolabe.ephemeris;

public enum CalendarType {
    /** Proleptic Gregorian calendar, applied to every date including those before 1582. */
    GREGORIAN,
    JULIAN
}
