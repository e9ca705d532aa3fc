package io.github.jakubt4.panchang.service.muhurat;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * A named window of civil time, start inclusive, end exclusive.
 */
public record MuhuratWindow(
        Muhurat muhurat,
        String label,
        Muhurat.Nature nature,
        OffsetDateTime start,
        OffsetDateTime end) {

    static MuhuratWindow of(final Muhurat muhurat, final OffsetDateTime start, final OffsetDateTime end) {
        return new MuhuratWindow(muhurat, muhurat.getLabel(), muhurat.getNature(), start, end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean overlaps(final MuhuratWindow other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }
}
