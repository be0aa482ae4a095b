package io.github.jakubt4.astrolabe.model;

/**
 * Raw birth data as supplied by the caller. Parsing and validation happen in
 * {@link io.github.jakubt4.astrolabe.service.TemporalResolver}.
 *
 * @param date      calendar date, {@code yyyy-MM-dd}
 * @param time      local wall-clock time, {@code HH:mm} or {@code HH:mm:ss}
 * @param timezone  IANA zone id, e.g. {@code Europe/Bratislava}
 * @param latitude  geographic latitude in degrees, north positive, [-90, 90]
 * @param longitude geographic longitude in degrees, east positive, [-180, 180]
 */
public record BirthMoment(String date, String time, String timezone, double latitude, double longitude) {
}
