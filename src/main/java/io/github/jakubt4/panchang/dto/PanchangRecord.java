package io.github.jakubt4.panchang.dto;

import io.github.jakubt4.panchang.service.element.LunarCalendar;
import io.github.jakubt4.panchang.service.element.PanchangElement;
import io.github.jakubt4.panchang.service.muhurat.MuhuratWindow;
import io.github.jakubt4.panchang.service.occasion.Occasion;
import io.github.jakubt4.panchang.service.solar.SolarTimes;
import io.github.jakubt4.panchang.service.verification.Verification;
import lombok.Builder;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Complete Panchang for one instant and place. Built once per request and never modified;
 * {@link #withVerification} returns a new record.
 */
@Builder(toBuilder = true)
public record PanchangRecord(
        LocalDate date,
        OffsetDateTime instant,
        Location location,
        PanchangElement vara,
        PanchangElement tithi,
        PanchangElement nakshatra,
        PanchangElement yoga,
        PanchangElement karana,
        MoonData moon,
        LunarCalendar calendar,
        SolarTimes solarTimes,
        List<MuhuratWindow> muhurats,
        List<Occasion> occasions,
        Provenance provenance) {

    public PanchangRecord withVerification(final Verification verification) {
        return toBuilder()
                .provenance(provenance.withVerification(verification))
                .build();
    }
}
