package io.github.jakubt4.panchang.service.element;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lunar months in amanta reckoning, Chaitra first.
 */
@Getter
@RequiredArgsConstructor
public enum Masa {

    CHAITRA("Chaitra", "चैत्र"),
    VAISHAKHA("Vaishakha", "वैशाख"),
    JYESHTHA("Jyeshtha", "ज्येष्ठ"),
    ASHADHA("Ashadha", "आषाढ"),
    SHRAVANA("Shravana", "श्रावण"),
    BHADRAPADA("Bhadrapada", "भाद्रपद"),
    ASHWIN("Ashwin", "आश्विन"),
    KARTIKA("Kartika", "कार्तिक"),
    MARGASHIRSHA("Margashirsha", "मार्गशीर्ष"),
    PAUSHA("Pausha", "पौष"),
    MAGHA("Magha", "माघ"),
    PHALGUNA("Phalguna", "फाल्गुन");

    private static final String[] RITUS = {"Vasanta", "Grishma", "Varsha", "Sharad", "Hemanta", "Shishira"};

    @JsonValue
    private final String displayName;
    private final String sanskritName;

    /**
     * The month that begins at a new moon while the Sun is in the given sidereal sign.
     * The new moon with the Sun in Meena opens Chaitra.
     */
    public static Masa startingInSign(final int sunSignIndex) {
        return values()[Math.floorMod(sunSignIndex + 1, 12)];
    }

    public String ritu() {
        return RITUS[ordinal() / 2];
    }
}
