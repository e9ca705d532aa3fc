package io.github.jakubt4.panchang.service;

/**
 * Rejected query input: an unparseable date, time or timezone, or a coordinate outside the globe.
 * The only failure the engine surfaces to its caller.
 */
public class InvalidPanchangInputException extends IllegalArgumentException {

    public InvalidPanchangInputException(final String message) {
        super(message);
    }

    public InvalidPanchangInputException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
