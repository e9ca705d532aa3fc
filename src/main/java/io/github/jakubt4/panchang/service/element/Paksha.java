package io.github.jakubt4.panchang.service.element;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Paksha {

    SHUKLA("Shukla Paksha"),
    KRISHNA("Krishna Paksha");

    @JsonValue
    private final String label;

    /**
     * @param tithiIndex tithi of the lunar month, 1..30
     */
    public static Paksha ofTithi(final int tithiIndex) {
        return tithiIndex <= 15 ? SHUKLA : KRISHNA;
    }
}
