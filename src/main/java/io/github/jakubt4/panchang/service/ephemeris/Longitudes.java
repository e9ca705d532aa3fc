package io.github.jakubt4.panchang.service.ephemeris;

/**
 * Sun and Moon ecliptic longitudes for one instant, in degrees {@code [0, 360)}.
 *
 * @param sunLongitude  longitude of the Sun
 * @param moonLongitude longitude of the Moon
 */
public record Longitudes(double sunLongitude, double moonLongitude) {

    /**
     * Moon minus Sun, the angle that drives Tithi and Karana.
     */
    public double elongation() {
        return Angles.normalize(moonLongitude - sunLongitude);
    }

    /**
     * Sun plus Moon, the angle that drives Yoga.
     */
    public double combined() {
        return Angles.normalize(sunLongitude + moonLongitude);
    }
}
