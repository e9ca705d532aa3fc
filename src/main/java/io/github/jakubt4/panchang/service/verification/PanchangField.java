package io.github.jakubt4.panchang.service.verification;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Fields compared between the computed record and the secondary source, in report order.
 */
@Getter
@RequiredArgsConstructor
public enum PanchangField {

    TITHI("tithi", "Tithi"),
    NAKSHATRA("nakshatra", "Nakshatra"),
    YOGA("yoga", "Yoga"),
    KARANA("karana", "Karana"),
    VARA("vara", "Weekday|Vara");

    private final String key;
    /** Regex alternation of the labels the source page uses for this field. */
    private final String pageLabel;
}
