package io.github.jakubt4.panchang.service.element;

/**
 * @param paksha              current fortnight
 * @param phase               one of eight named phases, New Moon first
 * @param illuminationPercent illuminated fraction of the disc, 0..100, one decimal
 */
public record LunarPhase(Paksha paksha, String phase, double illuminationPercent) {
}
