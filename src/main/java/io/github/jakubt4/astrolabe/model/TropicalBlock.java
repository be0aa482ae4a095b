package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.ephemeris.HouseSystem;

import java.util.List;

/**
 * Tropical (seasonal frame) half of a {@link PlacementAggregate}.
 *
 * @param houseCusps cusps of houses 1..12, index 0 holding the first house
 * @param planets    the ten bodies Sun through Pluto, in that order
 */
public record TropicalBlock(HouseSystem houseSystem,
                            ZodiacPosition sun,
                            ZodiacPosition moon,
                            ZodiacPosition ascendant,
                            int sunHouse,
                            int moonHouse,
                            double mcLongitude,
                            List<Double> houseCusps,
                            List<PlanetPlacement> planets,
                            NodeAxis nodes,
                            List<Aspect> aspects) {
}
