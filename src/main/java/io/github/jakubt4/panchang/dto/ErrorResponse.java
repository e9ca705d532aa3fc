package io.github.jakubt4.panchang.dto;

/**
 * Body returned when a Panchang request is rejected.
 *
 * @param status  always {@code "REJECTED"}
 * @param message human-readable reason
 */
public record ErrorResponse(String status, String message) {

    public static ErrorResponse rejected(final String message) {
        return new ErrorResponse("REJECTED", message);
    }
}
