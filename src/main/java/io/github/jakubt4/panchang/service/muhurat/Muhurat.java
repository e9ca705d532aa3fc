package io.github.jakubt4.panchang.service.muhurat;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Muhurat {

    BRAHMA_MUHURAT("Brahma Muhurat", Nature.AUSPICIOUS),
    AMRIT_KAAL("Amrit Kaal", Nature.AUSPICIOUS),
    ABHIJIT_MUHURAT("Abhijit Muhurat", Nature.AUSPICIOUS),
    RAHU_KAAL("Rahu Kaal", Nature.INAUSPICIOUS),
    YAMAGANDA_KAAL("Yamaganda Kaal", Nature.INAUSPICIOUS),
    GULIKA_KAAL("Gulika Kaal", Nature.INAUSPICIOUS);

    private final String label;
    private final Nature nature;

    public enum Nature {
        AUSPICIOUS,
        INAUSPICIOUS
    }
}
