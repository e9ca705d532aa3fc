package io.github.jakubt4.panchang.service.ephemeris;

/**
 * Offset between the tropical and the sidereal zodiac.
 *
 * <p>{@code LAHIRI} is the linear Chitrapaksha approximation (23°51'11" at J2000.0, precessing
 * about 50.3" per year). {@code NONE} keeps longitudes tropical.
 */
public enum Ayanamsa {

    LAHIRI(23.85306, 1.39722),
    NONE(0.0, 0.0);

    private final double valueAtJ2000;
    private final double ratePerCentury;

    Ayanamsa(final double valueAtJ2000, final double ratePerCentury) {
        this.valueAtJ2000 = valueAtJ2000;
        this.ratePerCentury = ratePerCentury;
    }

    /**
     * @param julianCenturies Julian centuries since J2000.0
     * @return ayanamsa in degrees
     */
    public double degrees(final double julianCenturies) {
        return valueAtJ2000 + ratePerCentury * julianCenturies;
    }
}
