package io.github.jakubt4.astrolabe.service;

/**
 * The reference computation did not reproduce its known result, so the ephemeris data is
 * missing or misconfigured. A readiness failure of the whole computation tier, not of a
 * single request.
 */
public class EphemerisConfigurationException extends RuntimeException {

    public EphemerisConfigurationException(final String message) {
        super(message);
    }

    public EphemerisConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
