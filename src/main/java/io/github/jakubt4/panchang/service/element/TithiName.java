package io.github.jakubt4.panchang.service.element;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Names of the lunar days. The first fourteen repeat in both fortnights; the fifteenth is
 * Purnima in Shukla Paksha and Amavasya in Krishna Paksha.
 */
@Getter
@RequiredArgsConstructor
public enum TithiName {

    PRATIPADA("Pratipada", "प्रतिपदा", "Agni"),
    DWITIYA("Dwitiya", "द्वितीया", "Brahma"),
    TRITIYA("Tritiya", "तृतीया", "Gauri"),
    CHATURTHI("Chaturthi", "चतुर्थी", "Ganesha"),
    PANCHAMI("Panchami", "पञ्चमी", "Nagas"),
    SHASHTHI("Shashthi", "षष्ठी", "Kartikeya"),
    SAPTAMI("Saptami", "सप्तमी", "Surya"),
    ASHTAMI("Ashtami", "अष्टमी", "Shiva"),
    NAVAMI("Navami", "नवमी", "Durga"),
    DASHAMI("Dashami", "दशमी", "Yama"),
    EKADASHI("Ekadashi", "एकादशी", "Vishvedevas"),
    DWADASHI("Dwadashi", "द्वादशी", "Vishnu"),
    TRAYODASHI("Trayodashi", "त्रयोदशी", "Kamadeva"),
    CHATURDASHI("Chaturdashi", "चतुर्दशी", "Shiva"),
    PURNIMA("Purnima", "पूर्णिमा", "Chandra"),
    AMAVASYA("Amavasya", "अमावस्या", "Pitris");

    private final String displayName;
    private final String sanskritName;
    private final String deity;

    /**
     * @param tithiIndex tithi of the lunar month, 1..30
     */
    public static TithiName ofIndex(final int tithiIndex) {
        if (tithiIndex == 15) {
            return PURNIMA;
        }
        if (tithiIndex >= 30) {
            return AMAVASYA;
        }
        return values()[(tithiIndex - 1) % 15];
    }

    /**
     * Day number within its fortnight, 1..15.
     */
    public static int dayOfPaksha(final int tithiIndex) {
        return (tithiIndex - 1) % 15 + 1;
    }
}
