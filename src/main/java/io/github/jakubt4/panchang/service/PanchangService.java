package io.github.jakubt4.panchang.service;

import io.github.jakubt4.panchang.dto.PanchangRecord;
import io.github.jakubt4.panchang.service.verification.PanchangVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalTime;
import java.time.OffsetDateTime;

/**
 * Entry point of the engine. Runs COMPUTE, then the best-effort VERIFY, then ASSEMBLE.
 *
 * <p>Only invalid input fails a request. Every other problem is reported inside the record's
 * provenance.
 */
@Slf4j
@Service
public class PanchangService {

    private final PanchangCalculator calculator;
    private final PanchangVerifier verifier;
    private final LocalTime referenceTime;

    public PanchangService(final PanchangCalculator calculator,
                           final PanchangVerifier verifier,
                           @Value("${panchang.reference-time:06:00}") final String referenceTime) {
        this.calculator = calculator;
        this.verifier = verifier;
        this.referenceTime = LocalTime.parse(referenceTime);
    }

    public PanchangRecord computePanchang(final String date, final double latitude, final double longitude,
                                          final String city) {
        return computePanchang(date, latitude, longitude, city, null);
    }

    /**
     * @throws InvalidPanchangInputException on an unparseable date or timezone or an out-of-range coordinate
     */
    public PanchangRecord computePanchang(final String date, final double latitude, final double longitude,
                                          final String city, final String timezone) {
        final var query = PanchangQuery.parse(date, latitude, longitude, city, timezone, referenceTime);
        return computeRecord(query.instant(), query.coordinate(), query.city());
    }

    /**
     * @throws InvalidPanchangInputException if the instant or the coordinate is missing
     */
    public PanchangRecord computeRecord(final OffsetDateTime instant, final GeoCoordinate coordinate,
                                        final String cityHint) {
        if (instant == null) {
            throw new InvalidPanchangInputException("Instant is required");
        }
        if (coordinate == null) {
            throw new InvalidPanchangInputException("Coordinate is required");
        }
        final var computed = calculator.compute(instant, coordinate, cityHint);
        final var verification = verifier.verify(computed);
        final var record = computed.withVerification(verification);

        log.info("Panchang {} at ({}, {}): {} / {} / {} / {}, verification={}",
                instant, coordinate.latitude(), coordinate.longitude(),
                record.tithi().name(), record.nakshatra().name(), record.yoga().name(), record.karana().name(),
                verification.status());
        return record;
    }
}
