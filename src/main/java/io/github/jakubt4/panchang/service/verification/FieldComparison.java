package io.github.jakubt4.panchang.service.verification;

/**
 * @param computed name produced by the engine
 * @param observed text read from the secondary source
 * @param matched  whether the observed text names the computed element
 */
public record FieldComparison(String computed, String observed, boolean matched) {
}
