package io.github.jakubt4.panchang.service.solar;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Sun timings for one civil date at one place.
 *
 * <p>When {@link #daylight()} is not {@link Daylight#NORMAL} there is no sunrise or sunset and
 * both are {@code null}; solar noon is still given.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SolarTimes(
        LocalDate date,
        Daylight daylight,
        OffsetDateTime sunrise,
        OffsetDateTime sunset,
        OffsetDateTime solarNoon,
        Duration dayLength,
        Duration nightLength) {

    private static final Duration FULL_DAY = Duration.ofHours(24);

    static SolarTimes of(final LocalDate date, final OffsetDateTime sunrise,
                         final OffsetDateTime solarNoon, final OffsetDateTime sunset) {
        final var dayLength = Duration.between(sunrise, sunset);
        return new SolarTimes(date, Daylight.NORMAL, sunrise, sunset, solarNoon,
                dayLength, FULL_DAY.minus(dayLength));
    }

    static SolarTimes polar(final LocalDate date, final Daylight daylight, final OffsetDateTime solarNoon) {
        final var dayLength = daylight == Daylight.POLAR_DAY ? FULL_DAY : Duration.ZERO;
        return new SolarTimes(date, daylight, null, null, solarNoon, dayLength, FULL_DAY.minus(dayLength));
    }

    @JsonIgnore
    public boolean isPolar() {
        return daylight != Daylight.NORMAL;
    }
}
