package io.github.jakubt4.panchang.dto;

import io.github.jakubt4.panchang.service.element.MoonSign;
import io.github.jakubt4.panchang.service.element.Paksha;

public record MoonData(MoonSign rashi, Paksha paksha, String phase, double illuminationPercent) {
}
