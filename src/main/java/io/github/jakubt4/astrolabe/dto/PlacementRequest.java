package io.github.jakubt4.astrolabe.dto;

import io.github.jakubt4.astrolabe.model.BirthMoment;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Inbound birth data for the placement and snapshot endpoints.
 *
 * @param date      birth date, {@code yyyy-MM-dd}
 * @param time      local wall-clock time, {@code HH:mm} or {@code HH:mm:ss}
 * @param timezone  IANA zone id (e.g. "Europe/Bratislava")
 * @param latitude  degrees, north positive
 * @param longitude degrees, east positive
 */
public record PlacementRequest(@NotBlank String date,
                               @NotBlank String time,
                               @NotBlank String timezone,
                               @NotNull @DecimalMin("-90.0") @DecimalMax("90.0") Double latitude,
                               @NotNull @DecimalMin("-180.0") @DecimalMax("180.0") Double longitude) {

    public BirthMoment toBirthMoment() {
        return new BirthMoment(date, time, timezone, latitude, longitude);
    }
}
