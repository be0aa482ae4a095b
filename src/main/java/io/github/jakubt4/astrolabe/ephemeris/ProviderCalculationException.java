package io.github.jakubt4.astrolabe.ephemeris;

/**
 * Raised when the ephemeris provider cannot compute a body position or a house frame.
 *
 * <p>Always fatal for the computation that triggered it: callers never receive a partially
 * populated placement.
 */
public class ProviderCalculationException extends RuntimeException {

    public ProviderCalculationException(final String message) {
        super(message);
    }

    public ProviderCalculationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
