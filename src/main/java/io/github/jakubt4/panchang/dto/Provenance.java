package io.github.jakubt4.panchang.dto;

import io.github.jakubt4.panchang.service.ephemeris.Ayanamsa;
import io.github.jakubt4.panchang.service.verification.Verification;

/**
 * How a record was produced.
 *
 * @param computationMethod ephemeris series and zodiac used
 * @param ayanamsa          sidereal correction applied
 * @param verified          whether the secondary source confirmed every compared field
 * @param verification      details of the cross-check
 */
public record Provenance(String computationMethod, Ayanamsa ayanamsa, boolean verified, Verification verification) {

    public Provenance withVerification(final Verification outcome) {
        return new Provenance(computationMethod, ayanamsa, outcome.verified(), outcome);
    }
}
