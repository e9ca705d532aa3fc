package io.github.jakubt4.panchang.service.ephemeris;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

/**
 * Truncated analytical series for the Sun and the Moon, good to a few tenths of a degree.
 *
 * <p>Sun: geometric mean longitude plus a two-term equation of centre. Moon: mean longitude plus
 * the equation of centre, evection, variation, the second harmonic of the anomaly and the annual
 * equation. Coefficients follow the low-order terms of Meeus, <i>Astronomical Algorithms</i>.
 * The configured {@link Ayanamsa} is subtracted from both results.
 */
@Slf4j
@Component
public class LowPrecisionEphemeris implements Ephemeris {

    private final Ayanamsa ayanamsa;

    public LowPrecisionEphemeris(@Value("${panchang.ayanamsa:LAHIRI}") final Ayanamsa ayanamsa) {
        this.ayanamsa = ayanamsa;
    }

    @Override
    public Longitudes longitudes(final OffsetDateTime instant) {
        final var t = JulianTime.julianCenturies(instant);
        final var offset = ayanamsa.degrees(t);

        final var sun = Angles.normalize(solarLongitude(t) - offset);
        final var moon = Angles.normalize(lunarLongitude(t) - offset);

        log.debug("T={} ayanamsa={} sun={} moon={}", t, offset, sun, moon);
        return new Longitudes(sun, moon);
    }

    @Override
    public String computationMethod() {
        return "Low-precision analytical series (Sun: 2-term equation of centre, Moon: 5 periodic terms), "
                + (ayanamsa == Ayanamsa.NONE ? "tropical zodiac" : ayanamsa.name() + " ayanamsa");
    }

    @Override
    public Ayanamsa ayanamsa() {
        return ayanamsa;
    }

    /**
     * Tropical longitude of the Sun.
     *
     * @param t Julian centuries since J2000.0
     */
    static double solarLongitude(final double t) {
        final var meanLongitude = 280.46646 + t * (36000.76983 + t * 0.0003032);
        final var meanAnomaly = 357.52911 + t * (35999.05029 - t * 0.0001537);
        final var equationOfCentre = (1.914602 - t * 0.004817) * Angles.sinDeg(meanAnomaly)
                + 0.019993 * Angles.sinDeg(2 * meanAnomaly);
        return Angles.normalize(meanLongitude + equationOfCentre);
    }

    /**
     * Tropical longitude of the Moon.
     *
     * @param t Julian centuries since J2000.0
     */
    static double lunarLongitude(final double t) {
        final var meanLongitude = 218.3164477 + 481267.88123421 * t;
        final var meanElongation = 297.8501921 + 445267.1114034 * t;
        final var sunAnomaly = 357.5291092 + 35999.0502909 * t;
        final var moonAnomaly = 134.9633964 + 477198.8675055 * t;

        final var correction = 6.288774 * Angles.sinDeg(moonAnomaly)
                + 1.274027 * Angles.sinDeg(2 * meanElongation - moonAnomaly)
                + 0.658314 * Angles.sinDeg(2 * meanElongation)
                + 0.213618 * Angles.sinDeg(2 * moonAnomaly)
                - 0.185116 * Angles.sinDeg(sunAnomaly);
        return Angles.normalize(meanLongitude + correction);
    }
}
