package io.github.jakubt4.panchang.service.ephemeris;

import org.hipparchus.util.FastMath;

/**
 * Degree-based angle helpers shared by the ephemeris and the element tables.
 */
public final class Angles {

    public static final double FULL_CIRCLE = 360.0;

    private Angles() {
    }

    /**
     * Reduces an angle to {@code [0, 360)}. Non-finite input collapses to {@code 0}.
     */
    public static double normalize(final double degrees) {
        final var normalized = degrees - FULL_CIRCLE * FastMath.floor(degrees / FULL_CIRCLE);
        if (!(normalized >= 0.0 && normalized < FULL_CIRCLE)) {
            return 0.0;
        }
        return normalized;
    }

    /**
     * Zero-based sector containing {@code degrees} when the circle is cut into sectors of
     * {@code width}, clamped to {@code [0, count - 1]}.
     */
    public static int sector(final double degrees, final double width, final int count) {
        final var index = (int) FastMath.floor(normalize(degrees) / width);
        return FastMath.max(0, FastMath.min(count - 1, index));
    }

    public static double sinDeg(final double degrees) {
        return FastMath.sin(FastMath.toRadians(degrees));
    }

    public static double cosDeg(final double degrees) {
        return FastMath.cos(FastMath.toRadians(degrees));
    }

    public static double tanDeg(final double degrees) {
        return FastMath.tan(FastMath.toRadians(degrees));
    }
}
