package io.github.jakubt4.panchang.service.solar;

import io.github.jakubt4.panchang.service.GeoCoordinate;
import io.github.jakubt4.panchang.service.ephemeris.Angles;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Sunrise, sunset and solar noon from a declination and hour-angle model.
 *
 * <p>Declination is Cooper's single sine term, {@code 23.44° · sin(360/365 · (284 + N))}; the
 * half-day arc is {@code acos(−tan φ · tan δ)}. Solar noon is shifted from 12:00 local mean time
 * by the longitude and a three-term equation of time. Refraction and the solar disc radius are
 * ignored, so the times are geometric.
 */
@Slf4j
@Component
public class SolarClock {

    private static final double OBLIQUITY = 23.44;
    private static final double MINUTES_PER_DEGREE = 4.0;
    private static final double NOON_MINUTES = 720.0;

    public SolarTimes solarTimes(final LocalDate date, final GeoCoordinate coordinate) {
        return solarTimes(date, coordinate, coordinate.estimatedUtcOffset());
    }

    public SolarTimes solarTimes(final LocalDate date, final GeoCoordinate coordinate, final ZoneOffset offset) {
        final var dayOfYear = date.getDayOfYear();
        final var declination = declination(dayOfYear);

        final var noonUtcMinutes = NOON_MINUTES
                - MINUTES_PER_DEGREE * coordinate.longitude()
                - equationOfTime(dayOfYear);
        final var solarNoon = civil(date, noonUtcMinutes, offset);

        final var cosHourAngle = -Angles.tanDeg(coordinate.latitude()) * Angles.tanDeg(declination);
        if (cosHourAngle > 1.0) {
            log.debug("{} at lat={}: Sun never rises (declination={})", date, coordinate.latitude(), declination);
            return SolarTimes.polar(date, Daylight.POLAR_NIGHT, solarNoon);
        }
        if (cosHourAngle < -1.0) {
            log.debug("{} at lat={}: Sun never sets (declination={})", date, coordinate.latitude(), declination);
            return SolarTimes.polar(date, Daylight.POLAR_DAY, solarNoon);
        }

        final var halfDayMinutes = FastMath.toDegrees(FastMath.acos(cosHourAngle)) * MINUTES_PER_DEGREE;
        return SolarTimes.of(date,
                civil(date, noonUtcMinutes - halfDayMinutes, offset),
                solarNoon,
                civil(date, noonUtcMinutes + halfDayMinutes, offset));
    }

    /**
     * Solar declination in degrees for a day of the year.
     */
    static double declination(final int dayOfYear) {
        return OBLIQUITY * Angles.sinDeg(360.0 / 365.0 * (284 + dayOfYear));
    }

    /**
     * Apparent minus mean solar time, in minutes.
     */
    static double equationOfTime(final int dayOfYear) {
        final var b = 360.0 / 364.0 * (dayOfYear - 81);
        return 9.87 * Angles.sinDeg(2 * b) - 7.53 * Angles.cosDeg(b) - 1.5 * Angles.sinDeg(b);
    }

    private static OffsetDateTime civil(final LocalDate date, final double utcMinutes, final ZoneOffset offset) {
        final var seconds = FastMath.round(utcMinutes * 60.0);
        return date.atStartOfDay()
                .atOffset(ZoneOffset.UTC)
                .plusSeconds(seconds)
                .withOffsetSameInstant(offset);
    }
}
