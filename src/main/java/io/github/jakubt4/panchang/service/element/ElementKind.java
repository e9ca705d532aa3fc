package io.github.jakubt4.panchang.service.element;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The Panchang elements and the number of distinct values each cycles through.
 */
@Getter
@RequiredArgsConstructor
public enum ElementKind {

    TITHI(30),
    NAKSHATRA(27),
    YOGA(27),
    KARANA(60),
    VARA(7);

    private final int modulus;
}
