package io.github.jakubt4.panchang.service.verification;

/**
 * The secondary source could not be fetched or read. Never escapes the verifier.
 */
public class VerificationUnavailableException extends RuntimeException {

    public VerificationUnavailableException(final String message) {
        super(message);
    }
}
