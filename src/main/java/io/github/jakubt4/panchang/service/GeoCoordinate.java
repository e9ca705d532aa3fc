package io.github.jakubt4.panchang.service;

import org.hipparchus.util.FastMath;

import java.time.ZoneOffset;

/**
 * Observer position on the Earth, in decimal degrees.
 *
 * @param latitude  north positive, {@code [-90, 90]}
 * @param longitude east positive, {@code [-180, 180]}
 * @throws InvalidPanchangInputException if either value is out of range or not a number
 */
public record GeoCoordinate(double latitude, double longitude) {

    public GeoCoordinate {
        if (!(latitude >= -90.0 && latitude <= 90.0)) {
            throw new InvalidPanchangInputException("Latitude must be within [-90, 90], got " + latitude);
        }
        if (!(longitude >= -180.0 && longitude <= 180.0)) {
            throw new InvalidPanchangInputException("Longitude must be within [-180, 180], got " + longitude);
        }
    }

    /**
     * Whole-hour UTC offset of the nominal time zone for this longitude, {@code round(longitude / 15)}.
     */
    public ZoneOffset estimatedUtcOffset() {
        return ZoneOffset.ofHours((int) FastMath.round(longitude / 15.0));
    }
}
