package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.zodiac.Graha;

import java.time.LocalDate;
import java.util.List;

/**
 * A Vimshottari period. Mahadashas carry their nine antardashas as sub-periods; antardashas
 * carry none.
 *
 * @param years nominal length of the period in years (the first mahadasha is shortened by the
 *              part of the birth nakshatra the Moon had already traversed)
 */
public record DashaPeriod(Graha lord, double years, LocalDate startDate, LocalDate endDate,
                          List<DashaPeriod> subPeriods) {
}
