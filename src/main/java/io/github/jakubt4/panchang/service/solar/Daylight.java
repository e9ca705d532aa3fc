package io.github.jakubt4.panchang.service.solar;

/**
 * Whether the Sun crosses the horizon on a given day.
 */
public enum Daylight {

    /** Sun rises and sets. */
    NORMAL,
    /** Sun stays above the horizon all day. */
    POLAR_DAY,
    /** Sun stays below the horizon all day. */
    POLAR_NIGHT
}
