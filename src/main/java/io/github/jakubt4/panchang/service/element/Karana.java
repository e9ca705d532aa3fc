package io.github.jakubt4.panchang.service.element;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Half-tithi names: seven movable karanas that repeat eight times through the month, and four
 * fixed karanas bound to the first and the last three half-tithis.
 */
@Getter
@RequiredArgsConstructor
public enum Karana {

    BAVA("Bava", "बव", true),
    BALAVA("Balava", "बालव", true),
    KAULAVA("Kaulava", "कौलव", true),
    TAITILA("Taitila", "तैतिल", true),
    GARA("Gara", "गर", true),
    VANIJA("Vanija", "वणिज", true),
    VISHTI("Vishti", "विष्टि", true),
    SHAKUNI("Shakuni", "शकुनि", false),
    CHATUSHPADA("Chatushpada", "चतुष्पद", false),
    NAGA("Naga", "नाग", false),
    KIMSTUGHNA("Kimstughna", "किंस्तुघ्न", false);

    private static final int MOVABLE_COUNT = 7;

    private final String displayName;
    private final String sanskritName;
    private final boolean movable;

    /**
     * @param halfTithi zero-based half-tithi of the lunar month, 0..59
     */
    public static Karana ofHalfTithi(final int halfTithi) {
        final var index = Math.floorMod(halfTithi, 60);
        return switch (index) {
            case 0 -> KIMSTUGHNA;
            case 57 -> SHAKUNI;
            case 58 -> CHATUSHPADA;
            case 59 -> NAGA;
            default -> values()[(index - 1) % MOVABLE_COUNT];
        };
    }
}
