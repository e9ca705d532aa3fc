package io.github.jakubt4.panchang.service.verification;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ElementNameMatcherTest {

    @Test
    void ignoresPakshaPrefixAndTrailingTiming() {
        assertThat(ElementNameMatcher.matches(List.of("Ekadashi"), "Shukla Ekadashi upto 10:23 PM")).isTrue();
    }

    @Test
    void acceptsCommonSpellingVariants() {
        assertThat(ElementNameMatcher.matches(List.of("Priti"), "Preeti")).isTrue();
        assertThat(ElementNameMatcher.matches(List.of("Mrigashira"), "Mrigashirsha upto 04:10 AM")).isTrue();
        assertThat(ElementNameMatcher.matches(List.of("Dwadashi"), "Dvadashi")).isTrue();
        assertThat(ElementNameMatcher.matches(List.of("Vanija"), "Vanij")).isTrue();
    }

    @Test
    void yogaNamedShuklaStillMatches() {
        assertThat(ElementNameMatcher.matches(List.of("Shukla"), "Shukla upto 09:00 PM")).isTrue();
    }

    @Test
    void anyCandidateMayMatch() {
        assertThat(ElementNameMatcher.matches(List.of("Shukravara", "Friday"), "Friday")).isTrue();
    }

    @Test
    void differentElementDoesNotMatch() {
        assertThat(ElementNameMatcher.matches(List.of("Dwadashi"), "Ekadashi upto 10:23 PM")).isFalse();
        assertThat(ElementNameMatcher.matches(List.of("Uttara Phalguni"), "Purva Phalguni")).isFalse();
    }

    @Test
    void nameInsideALongerNameDoesNotMatch() {
        assertThat(ElementNameMatcher.matches(List.of("Ganda"), "Atiganda upto 11:02 PM")).isFalse();
        assertThat(ElementNameMatcher.matches(List.of("Atiganda"), "Atiganda upto 11:02 PM")).isTrue();
        assertThat(ElementNameMatcher.matches(List.of("Siddha"), "Siddhi")).isFalse();
    }

    @Test
    void multiWordNamesMatchAcrossSpacingVariants() {
        assertThat(ElementNameMatcher.matches(List.of("Purva Ashadha"), "Purvashadha upto 01:15 AM")).isTrue();
        assertThat(ElementNameMatcher.matches(List.of("Uttara Bhadrapada"), "Uttara Bhadrapada")).isTrue();
        assertThat(ElementNameMatcher.matches(List.of("Purva Bhadrapada"), "Uttara Bhadrapada")).isFalse();
    }

    @Test
    void emptyObservedTextNeverMatches() {
        assertThat(ElementNameMatcher.matches(List.of("Bava"), "  ")).isFalse();
        assertThat(ElementNameMatcher.matches(List.of("Bava"), null)).isFalse();
    }
}
