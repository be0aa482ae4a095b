package io.github.jakubt4.astrolabe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Astrolabe — natal placement engine.
 *
 * <p>Resolves a birth moment to an instant, computes body positions from JPL DE ephemerides via
 * Orekit and decomposes them into tropical and sidereal zodiac coordinates, lunar mansions and
 * gate wheel activations.
 *
 * @see io.github.jakubt4.astrolabe.service.PlacementEngine
 * @see io.github.jakubt4.astrolabe.service.SiderealTransform
 */
@SpringBootApplication
@EnableRetry
public class AstrolabeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AstrolabeApplication.class, args);
    }
}
