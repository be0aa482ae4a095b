package io.github.jakubt4.astrolabe.dto;

/**
 * Error body returned by the REST API.
 *
 * @param error   failure category, e.g. {@code "INVALID_BIRTH_MOMENT"}
 * @param message human-readable detail
 */
public record ErrorResponse(String error, String message) {
}
