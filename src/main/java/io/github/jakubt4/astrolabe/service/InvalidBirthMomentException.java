package io.github.jakubt4.astrolabe.service;

/**
 * The birth moment cannot be turned into an instant: unparseable date, time or zone, a local
 * time skipped by a daylight-saving transition, or coordinates out of range. Never replaced
 * by a default.
 */
public class InvalidBirthMomentException extends RuntimeException {

    public InvalidBirthMomentException(final String message) {
        super(message);
    }

    public InvalidBirthMomentException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
