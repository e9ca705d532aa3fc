package io.github.jakubt4.panchang.service.element;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Yoga {

    VISHKUMBHA("Vishkumbha", "विष्कम्भ", "Obstacles"),
    PRITI("Priti", "प्रीति", "Love"),
    AYUSHMAN("Ayushman", "आयुष्मान्", "Long life"),
    SAUBHAGYA("Saubhagya", "सौभाग्य", "Good fortune"),
    SHOBHANA("Shobhana", "शोभन", "Splendid"),
    ATIGANDA("Atiganda", "अतिगण्ड", "Great obstacles"),
    SUKARMA("Sukarma", "सुकर्मा", "Good deeds"),
    DHRITI("Dhriti", "धृति", "Resolve"),
    SHULA("Shula", "शूल", "Spear"),
    GANDA("Ganda", "गण्ड", "Obstacles"),
    VRIDDHI("Vriddhi", "वृद्धि", "Growth"),
    DHRUVA("Dhruva", "ध्रुव", "Fixed"),
    VYAGHATA("Vyaghata", "व्याघात", "Striking"),
    HARSHANA("Harshana", "हर्षण", "Joy"),
    VAJRA("Vajra", "वज्र", "Diamond"),
    SIDDHI("Siddhi", "सिद्धि", "Success"),
    VYATIPATA("Vyatipata", "व्यतीपात", "Calamity"),
    VARIYAN("Variyan", "वरीयान्", "Best"),
    PARIGHA("Parigha", "परिघ", "Iron bar"),
    SHIVA("Shiva", "शिव", "Auspicious"),
    SIDDHA("Siddha", "सिद्ध", "Accomplished"),
    SADHYA("Sadhya", "साध्य", "Achievable"),
    SHUBHA("Shubha", "शुभ", "Auspicious"),
    SHUKLA("Shukla", "शुक्ल", "Bright"),
    BRAHMA("Brahma", "ब्रह्म", "Sacred"),
    INDRA("Indra", "इन्द्र", "Powerful"),
    VAIDHRITI("Vaidhriti", "वैधृति", "Poor support");

    private final String displayName;
    private final String sanskritName;
    private final String meaning;

    public static Yoga ofIndex(final int index) {
        return values()[Math.floorMod(index, 27)];
    }
}
