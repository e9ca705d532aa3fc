package io.github.jakubt4.panchang.service.element;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The 27 lunar mansions, each 13°20' of sidereal longitude, with their Vimshottari lord and
 * presiding deity.
 */
@Getter
@RequiredArgsConstructor
public enum Nakshatra {

    ASHWINI("Ashwini", "अश्विनी", "Ketu", "Ashwini Kumaras"),
    BHARANI("Bharani", "भरणी", "Venus", "Yama"),
    KRITTIKA("Krittika", "कृत्तिका", "Sun", "Agni"),
    ROHINI("Rohini", "रोहिणी", "Moon", "Brahma"),
    MRIGASHIRA("Mrigashira", "मृगशिरा", "Mars", "Soma"),
    ARDRA("Ardra", "आर्द्रा", "Rahu", "Rudra"),
    PUNARVASU("Punarvasu", "पुनर्वसु", "Jupiter", "Aditi"),
    PUSHYA("Pushya", "पुष्य", "Saturn", "Brihaspati"),
    ASHLESHA("Ashlesha", "आश्लेषा", "Mercury", "Nagas"),
    MAGHA("Magha", "मघा", "Ketu", "Pitris"),
    PURVA_PHALGUNI("Purva Phalguni", "पूर्वाफाल्गुनी", "Venus", "Bhaga"),
    UTTARA_PHALGUNI("Uttara Phalguni", "उत्तराफाल्गुनी", "Sun", "Aryaman"),
    HASTA("Hasta", "हस्त", "Moon", "Savitar"),
    CHITRA("Chitra", "चित्रा", "Mars", "Tvashtar"),
    SWATI("Swati", "स्वाती", "Rahu", "Vayu"),
    VISHAKHA("Vishakha", "विशाखा", "Jupiter", "Indra-Agni"),
    ANURADHA("Anuradha", "अनुराधा", "Saturn", "Mitra"),
    JYESHTHA("Jyeshtha", "ज्येष्ठा", "Mercury", "Indra"),
    MULA("Mula", "मूल", "Ketu", "Nirriti"),
    PURVA_ASHADHA("Purva Ashadha", "पूर्वाषाढा", "Venus", "Apas"),
    UTTARA_ASHADHA("Uttara Ashadha", "उत्तराषाढा", "Sun", "Vishwadevas"),
    SHRAVANA("Shravana", "श्रवण", "Moon", "Vishnu"),
    DHANISHTA("Dhanishta", "धनिष्ठा", "Mars", "Vasus"),
    SHATABHISHA("Shatabhisha", "शतभिषा", "Rahu", "Varuna"),
    PURVA_BHADRAPADA("Purva Bhadrapada", "पूर्वाभाद्रपदा", "Jupiter", "Aja Ekapada"),
    UTTARA_BHADRAPADA("Uttara Bhadrapada", "उत्तराभाद्रपदा", "Saturn", "Ahir Budhnya"),
    REVATI("Revati", "रेवती", "Mercury", "Pushan");

    private final String displayName;
    private final String sanskritName;
    private final String lord;
    private final String deity;

    public static Nakshatra ofIndex(final int index) {
        return values()[Math.floorMod(index, 27)];
    }
}
