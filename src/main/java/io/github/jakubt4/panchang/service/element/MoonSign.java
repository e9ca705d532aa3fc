package io.github.jakubt4.panchang.service.element;

import java.time.OffsetDateTime;

/**
 * The sign (Rashi) occupied by the Moon.
 *
 * @param index        0..11, Mesha first
 * @param name         transliterated name
 * @param englishName  western sign name
 * @param sanskritName name in Devanagari
 * @param element      Fire, Earth, Air or Water
 * @param rulingPlanet lord of the sign
 * @param endTime      civil instant at which the Moon enters the next sign
 */
public record MoonSign(
        int index,
        String name,
        String englishName,
        String sanskritName,
        String element,
        String rulingPlanet,
        OffsetDateTime endTime) {

    static MoonSign of(final Rashi rashi, final OffsetDateTime endTime) {
        return new MoonSign(rashi.ordinal(), rashi.getDisplayName(), rashi.getEnglishName(),
                rashi.getSanskritName(), rashi.getElement(), rashi.getRulingPlanet(), endTime);
    }
}
