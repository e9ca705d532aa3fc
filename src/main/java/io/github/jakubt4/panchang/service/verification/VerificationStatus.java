package io.github.jakubt4.panchang.service.verification;

public enum VerificationStatus {

    /** Every field read from the secondary source agrees. */
    MATCHED,
    /** The source was read but at least one field disagrees. */
    MISMATCHED,
    /** The source timed out, failed, or could not be parsed. */
    UNAVAILABLE,
    /** Verification is switched off. */
    DISABLED
}
