package io.github.jakubt4.panchang.service;

import io.github.jakubt4.panchang.dto.Location;
import io.github.jakubt4.panchang.dto.MoonData;
import io.github.jakubt4.panchang.dto.PanchangRecord;
import io.github.jakubt4.panchang.dto.Provenance;
import io.github.jakubt4.panchang.service.element.ElementResolver;
import io.github.jakubt4.panchang.service.ephemeris.Ephemeris;
import io.github.jakubt4.panchang.service.muhurat.MuhuratScheduler;
import io.github.jakubt4.panchang.service.occasion.OccasionAnnotator;
import io.github.jakubt4.panchang.service.solar.SolarClock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

/**
 * The synchronous compute stage: ephemeris, elements, solar clock, muhurats and occasions for one
 * instant and place. Performs no I/O and never consults the wall clock.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PanchangCalculator {

    private final Ephemeris ephemeris;
    private final ElementResolver elementResolver;
    private final SolarClock solarClock;
    private final MuhuratScheduler muhuratScheduler;
    private final OccasionAnnotator occasionAnnotator;

    /**
     * @return a complete record whose provenance is not yet verified
     */
    public PanchangRecord compute(final OffsetDateTime instant, final GeoCoordinate coordinate, final String city) {
        final var longitudes = ephemeris.longitudes(instant);
        final var sun = longitudes.sunLongitude();
        final var moon = longitudes.moonLongitude();

        final var elements = elementResolver.resolveElements(sun, moon, instant);
        final var vara = elementResolver.resolveVara(instant);
        final var phase = elementResolver.resolvePhase(sun, moon);
        final var calendar = elementResolver.resolveCalendar(sun, moon);

        final var date = instant.toLocalDate();
        final var solarTimes = solarClock.solarTimes(date, coordinate, instant.getOffset());
        final var muhurats = muhuratScheduler.muhuratWindows(solarTimes, instant.getDayOfWeek());
        final var occasions = occasionAnnotator.occasions(
                elements.tithi().index(), calendar.masa(), instant.getDayOfWeek());

        log.debug("Computed {} at ({}, {}): tithi={} nakshatra={} daylight={}", instant,
                coordinate.latitude(), coordinate.longitude(),
                elements.tithi().name(), elements.nakshatra().name(), solarTimes.daylight());

        return PanchangRecord.builder()
                .date(date)
                .instant(instant)
                .location(new Location(coordinate.latitude(), coordinate.longitude(),
                        instant.getOffset().getId(), city))
                .vara(vara)
                .tithi(elements.tithi())
                .nakshatra(elements.nakshatra())
                .yoga(elements.yoga())
                .karana(elements.karana())
                .moon(new MoonData(elements.rashi(), phase.paksha(), phase.phase(), phase.illuminationPercent()))
                .calendar(calendar)
                .solarTimes(solarTimes)
                .muhurats(muhurats)
                .occasions(occasions)
                .provenance(new Provenance(ephemeris.computationMethod(), ephemeris.ayanamsa(), false, null))
                .build();
    }
}
