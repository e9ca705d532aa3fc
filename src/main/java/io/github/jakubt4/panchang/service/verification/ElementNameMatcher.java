package io.github.jakubt4.panchang.service.verification;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Loose comparison of element names across transliteration schemes.
 *
 * <p>Both sides are lower-cased and split into letter-only words. A candidate matches when its
 * words, joined and mapped to one canonical spelling, equal a run of whole consecutive words of
 * the observed text, so trailing timings such as "upto 10:23 PM" and paksha prefixes do not
 * matter while a name inside a longer one (Ganda in Atiganda) does not match.
 */
final class ElementNameMatcher {

    private static final int MAX_NAME_WORDS = 3;
    private static final Pattern NON_LETTERS = Pattern.compile("[^a-z]+");

    // variant -> canonical, whole names only
    private static final Map<String, String> VARIANTS = Map.ofEntries(
            Map.entry("mrigashirsha", "mrigashira"),
            Map.entry("mrigasira", "mrigashira"),
            Map.entry("dhanishtha", "dhanishta"),
            Map.entry("ashvini", "ashwini"),
            Map.entry("moola", "mula"),
            Map.entry("purvashadha", "purvaashadha"),
            Map.entry("uttarashadha", "uttaraashadha"),
            Map.entry("purvabhadra", "purvabhadrapada"),
            Map.entry("uttarabhadra", "uttarabhadrapada"),
            Map.entry("preeti", "priti"),
            Map.entry("vishkambha", "vishkumbha"),
            Map.entry("kinstughna", "kimstughna"),
            Map.entry("taitula", "taitila"),
            Map.entry("vanij", "vanija"),
            Map.entry("chatushpad", "chatushpada"),
            Map.entry("pratipat", "pratipada"),
            Map.entry("dvitiya", "dwitiya"),
            Map.entry("dvadashi", "dwadashi"),
            Map.entry("shashti", "shashthi"),
            Map.entry("poornima", "purnima"),
            Map.entry("pournami", "purnima"));

    private ElementNameMatcher() {
    }

    /**
     * @return {@code true} if any candidate names a run of whole words in the observed text
     */
    static boolean matches(final Collection<String> candidates, final String observed) {
        final var words = words(observed);
        if (words.isEmpty()) {
            return false;
        }
        final var names = new HashSet<String>();
        for (var from = 0; from < words.size(); from++) {
            final var joined = new StringBuilder();
            for (var to = from; to < Math.min(words.size(), from + MAX_NAME_WORDS); to++) {
                joined.append(words.get(to));
                names.add(canonical(joined.toString()));
            }
        }
        return candidates.stream()
                .map(ElementNameMatcher::normalize)
                .filter(candidate -> !candidate.isEmpty())
                .anyMatch(names::contains);
    }

    /**
     * Canonical single-word spelling of a whole name, e.g. "Purva Ashadha" and "Purvashadha"
     * both become {@code purvaashadha}.
     */
    static String normalize(final String name) {
        return canonical(String.join("", words(name)));
    }

    private static List<String> words(final String text) {
        if (text == null) {
            return List.of();
        }
        return Arrays.stream(NON_LETTERS.split(text.toLowerCase(Locale.ROOT)))
                .filter(word -> !word.isEmpty())
                .toList();
    }

    private static String canonical(final String joined) {
        return VARIANTS.getOrDefault(joined, joined);
    }
}
