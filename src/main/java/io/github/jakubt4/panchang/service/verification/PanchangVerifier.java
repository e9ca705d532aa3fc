package io.github.jakubt4.panchang.service.verification;

import io.github.jakubt4.panchang.client.DrikPanchangClient;
import io.github.jakubt4.panchang.dto.PanchangRecord;
import io.github.jakubt4.panchang.service.element.PanchangElement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cross-checks a computed record against the secondary almanac.
 *
 * <p>Never fails the request: fetch errors, unparseable pages and timeouts all degrade to an
 * {@link VerificationStatus#UNAVAILABLE} outcome. The fetch runs on a dedicated, bounded pool so
 * the caller's wait is bounded by {@code panchang.verification.timeout-ms}; a fetch that overruns
 * is interrupted, and a request arriving while the queue is full is not verified.
 */
@Slf4j
@Service
public class PanchangVerifier {

    static final String DEFAULT_CITY = "New Delhi";

    private final DrikPanchangClient client;
    private final DrikPanchangPageParser parser;
    private final ExecutorService verificationExecutor;
    private final boolean enabled;
    private final long timeoutMs;

    public PanchangVerifier(final DrikPanchangClient client,
                            final DrikPanchangPageParser parser,
                            final ExecutorService verificationExecutor,
                            @Value("${panchang.verification.enabled:true}") final boolean enabled,
                            @Value("${panchang.verification.timeout-ms:8000}") final long timeoutMs) {
        this.client = client;
        this.parser = parser;
        this.verificationExecutor = verificationExecutor;
        this.enabled = enabled;
        this.timeoutMs = timeoutMs;
    }

    public Verification verify(final PanchangRecord computed) {
        if (!enabled) {
            return Verification.disabled();
        }

        final var city = computed.location().city() == null || computed.location().city().isBlank()
                ? DEFAULT_CITY
                : computed.location().city();

        final Future<Verification> future;
        try {
            future = verificationExecutor.submit(() -> fetchAndCompare(computed, city));
        } catch (final RejectedExecutionException e) {
            log.warn("Verification for {} / {} rejected: worker pool saturated", computed.date(), city);
            return Verification.unavailable("Verification queue is full");
        }

        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            // interrupts the worker so the pool thread is released
            future.cancel(true);
            log.warn("Verification for {} / {} timed out after {} ms", computed.date(), city, timeoutMs);
            return Verification.unavailable("Secondary source timed out after " + timeoutMs + " ms");
        } catch (final ExecutionException e) {
            final var cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Verification for {} / {} failed: {}", computed.date(), city, cause.getMessage());
            return Verification.unavailable(cause.getMessage());
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Verification.unavailable("Interrupted while waiting for secondary source");
        }
    }

    private Verification fetchAndCompare(final PanchangRecord computed, final String city) {
        final var page = client.fetchDayPanchang(computed.date(), city)
                .orElseThrow(() -> new VerificationUnavailableException("Secondary source returned no page"));
        final var observed = parser.parse(page);
        final var fields = compare(candidates(computed), observed);
        final var outcome = Verification.compared(client.getBaseUrl(), fields);

        log.info("Verification for {} / {}: {} ({} fields compared)",
                computed.date(), city, outcome.status(), fields.size());
        return outcome;
    }

    static Map<PanchangField, List<String>> candidates(final PanchangRecord computed) {
        final var candidates = new EnumMap<PanchangField, List<String>>(PanchangField.class);
        candidates.put(PanchangField.TITHI, names(computed.tithi()));
        candidates.put(PanchangField.NAKSHATRA, names(computed.nakshatra()));
        candidates.put(PanchangField.YOGA, names(computed.yoga()));
        candidates.put(PanchangField.KARANA, names(computed.karana()));
        candidates.put(PanchangField.VARA, names(computed.vara()));
        return candidates;
    }

    private static List<String> names(final PanchangElement element) {
        return element.englishName() == null
                ? List.of(element.name())
                : List.of(element.name(), element.englishName());
    }

    /**
     * Compares only the fields the page yielded; a field missing from the page is not a mismatch.
     */
    static Map<String, FieldComparison> compare(final Map<PanchangField, List<String>> candidates,
                                                final ObservedPanchang observed) {
        final var fields = new LinkedHashMap<String, FieldComparison>();
        candidates.forEach((field, names) -> observed.get(field).ifPresent(text ->
                fields.put(field.getKey(), new FieldComparison(
                        names.get(0), text, ElementNameMatcher.matches(names, text)))));
        return fields;
    }
}
