package io.github.jakubt4.panchang.service.element;

public record ResolvedElements(
        PanchangElement tithi,
        PanchangElement nakshatra,
        PanchangElement yoga,
        PanchangElement karana,
        MoonSign rashi) {
}
