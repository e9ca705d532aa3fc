package io.github.jakubt4.panchang.service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A validated Panchang request: the instant to evaluate, the observer and an optional place name.
 */
public record PanchangQuery(OffsetDateTime instant, GeoCoordinate coordinate, String city) {

    /**
     * Validates raw request input.
     *
     * @param date          {@code yyyy-MM-dd}, or {@code yyyy-MM-ddTHH:mm[:ss]} for a specific local time
     * @param latitude      decimal degrees
     * @param longitude     decimal degrees
     * @param city          optional place name
     * @param timezone      optional UTC offset ({@code +05:30}) or region id ({@code Asia/Kolkata});
     *                      when absent the offset is estimated from the longitude
     * @param referenceTime local time used when {@code date} carries no time of day
     * @throws InvalidPanchangInputException if any part cannot be parsed or is out of range
     */
    public static PanchangQuery parse(final String date, final double latitude, final double longitude,
                                      final String city, final String timezone, final LocalTime referenceTime) {
        final var coordinate = new GeoCoordinate(latitude, longitude);
        final var local = localDateTime(date, referenceTime);
        final var offset = isBlank(timezone)
                ? coordinate.estimatedUtcOffset()
                : offset(timezone.trim(), local);

        return new PanchangQuery(local.atOffset(offset), coordinate, isBlank(city) ? null : city.trim());
    }

    private static LocalDateTime localDateTime(final String date, final LocalTime referenceTime) {
        if (isBlank(date)) {
            throw new InvalidPanchangInputException("Date is required");
        }
        final var text = date.trim();
        try {
            return text.indexOf('T') >= 0
                    ? LocalDateTime.parse(text)
                    : LocalDate.parse(text).atTime(referenceTime);
        } catch (final DateTimeException e) {
            throw new InvalidPanchangInputException("Invalid date '" + text + "', expected yyyy-MM-dd[THH:mm[:ss]]", e);
        }
    }

    private static ZoneOffset offset(final String timezone, final LocalDateTime local) {
        try {
            if (timezone.startsWith("+") || timezone.startsWith("-") || "Z".equalsIgnoreCase(timezone)) {
                return ZoneOffset.of(timezone.toUpperCase());
            }
            return ZoneId.of(timezone).getRules().getOffset(local);
        } catch (final DateTimeException e) {
            throw new InvalidPanchangInputException("Invalid timezone '" + timezone + "'", e);
        }
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }
}
