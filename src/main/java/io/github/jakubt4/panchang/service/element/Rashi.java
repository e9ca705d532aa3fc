package io.github.jakubt4.panchang.service.element;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Rashi {

    MESHA("Mesha", "Aries", "मेष", "Fire", "Mars"),
    VRISHABHA("Vrishabha", "Taurus", "वृषभ", "Earth", "Venus"),
    MITHUNA("Mithuna", "Gemini", "मिथुन", "Air", "Mercury"),
    KARKA("Karka", "Cancer", "कर्क", "Water", "Moon"),
    SIMHA("Simha", "Leo", "सिंह", "Fire", "Sun"),
    KANYA("Kanya", "Virgo", "कन्या", "Earth", "Mercury"),
    TULA("Tula", "Libra", "तुला", "Air", "Venus"),
    VRISHCHIKA("Vrishchika", "Scorpio", "वृश्चिक", "Water", "Mars"),
    DHANU("Dhanu", "Sagittarius", "धनु", "Fire", "Jupiter"),
    MAKARA("Makara", "Capricorn", "मकर", "Earth", "Saturn"),
    KUMBHA("Kumbha", "Aquarius", "कुम्भ", "Air", "Saturn"),
    MEENA("Meena", "Pisces", "मीन", "Water", "Jupiter");

    private final String displayName;
    private final String englishName;
    private final String sanskritName;
    private final String element;
    private final String rulingPlanet;

    public static Rashi ofIndex(final int index) {
        return values()[Math.floorMod(index, 12)];
    }
}
