package io.github.jakubt4.panchang.service.ephemeris;

import java.time.OffsetDateTime;

/**
 * Source of Sun and Moon ecliptic longitudes.
 *
 * <p>Implementations must be pure: the same instant always yields the same longitudes.
 */
public interface Ephemeris {

    /**
     * @param instant civil instant with its UTC offset
     * @return Sun and Moon longitudes in degrees, both in {@code [0, 360)}
     */
    Longitudes longitudes(OffsetDateTime instant);

    /**
     * Human-readable name of the series and zodiac used, reported as record provenance.
     */
    String computationMethod();

    Ayanamsa ayanamsa();
}
