package io.github.jakubt4.panchang.service.verification;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of the optional cross-check against the secondary source.
 *
 * @param status   what happened
 * @param verified {@code true} only when the source was read and every compared field matched
 * @param source   where the observed values came from, if anywhere
 * @param reason   why verification was skipped or degraded
 * @param fields   per-field comparison keyed by field name, in {@link PanchangField} order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Verification(
        VerificationStatus status,
        boolean verified,
        String source,
        String reason,
        Map<String, FieldComparison> fields) {

    public Verification {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Verification disabled() {
        return new Verification(VerificationStatus.DISABLED, false, null, "Verification disabled", Map.of());
    }

    public static Verification unavailable(final String reason) {
        return new Verification(VerificationStatus.UNAVAILABLE, false, null, reason, Map.of());
    }

    public static Verification compared(final String source, final Map<String, FieldComparison> fields) {
        final var allMatched = fields.values().stream().allMatch(FieldComparison::matched);
        final var status = allMatched ? VerificationStatus.MATCHED : VerificationStatus.MISMATCHED;
        return new Verification(status, allMatched, source, null, fields);
    }
}
