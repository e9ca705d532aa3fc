package io.github.jakubt4.panchang.service.ephemeris;

import org.orekit.time.DateComponents;
import org.orekit.utils.Constants;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Converts civil instants to the J2000.0 time arguments used by the longitude series.
 *
 * <p>UT is used in place of TT; the ~70 s difference is far below the series' precision.
 */
public final class JulianTime {

    public static final double J2000_JULIAN_DAY = 2451545.0;

    private JulianTime() {
    }

    public static double secondsSinceJ2000(final OffsetDateTime instant) {
        final var utc = instant.withOffsetSameInstant(ZoneOffset.UTC);
        final var day = new DateComponents(utc.getYear(), utc.getMonthValue(), utc.getDayOfMonth());
        final var secondsInDay = utc.toLocalTime().toSecondOfDay() + utc.getNano() / 1.0e9;
        // J2000.0 is noon of day 0
        return day.getJ2000Day() * Constants.JULIAN_DAY + secondsInDay - Constants.JULIAN_DAY / 2;
    }

    public static double julianDay(final OffsetDateTime instant) {
        return J2000_JULIAN_DAY + secondsSinceJ2000(instant) / Constants.JULIAN_DAY;
    }

    public static double julianCenturies(final OffsetDateTime instant) {
        return secondsSinceJ2000(instant) / Constants.JULIAN_CENTURY;
    }
}
