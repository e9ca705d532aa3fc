package io.github.jakubt4.panchang.service.element;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.OffsetDateTime;

/**
 * One resolved Panchang element at the query instant.
 *
 * @param kind         which element this is
 * @param index        position in the element's cycle: Tithi 1..30, Nakshatra/Yoga 0..26, Karana 0..59, Vara 0..6
 * @param name         transliterated name
 * @param sanskritName name in Devanagari
 * @param englishName  English equivalent where one exists (Vara)
 * @param paksha       fortnight, for Tithi and Karana
 * @param deity        presiding deity, where tabulated
 * @param lord         ruling graha, where tabulated
 * @param meaning      gloss of the name, where tabulated
 * @param nextName     name of the element that follows {@code endTime}
 * @param endTime      civil instant at which this element ends; never before the query instant
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PanchangElement(
        ElementKind kind,
        int index,
        String name,
        String sanskritName,
        String englishName,
        Paksha paksha,
        String deity,
        String lord,
        String meaning,
        String nextName,
        OffsetDateTime endTime) {
}
