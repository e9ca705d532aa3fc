package io.github.jakubt4.panchang.service.verification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts the five element names from a rendered day-Panchang page.
 *
 * <p>Tries, per field and in order: the page's embedded JavaScript variables, a two-cell table row,
 * a key/value pair of adjacent {@code div}/{@code span} elements, and finally a plain
 * {@code Label: value} run of text.
 */
@Slf4j
@Component
public class DrikPanchangPageParser {

    private static final int MAX_VALUE_LENGTH = 120;
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Map<PanchangField, List<Pattern>> PATTERNS = new EnumMap<>(PanchangField.class);

    static {
        for (final var field : PanchangField.values()) {
            final var label = "(?:" + field.getPageLabel() + ")";
            final var jsKey = field.getKey().toLowerCase(Locale.ROOT);
            final var flags = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;
            PATTERNS.put(field, List.of(
                    Pattern.compile("drikp_g_" + jsKey + "_name_?\\s*=\\s*['\"]([^'\"]+)['\"]", flags),
                    Pattern.compile("<td[^>]*>\\s*" + label + "\\s*</td>\\s*<td[^>]*>(.*?)</td>", flags),
                    Pattern.compile(">\\s*" + label + "\\s*</(?:div|span)>\\s*<(?:div|span)[^>]*>(.*?)</(?:div|span)>", flags),
                    Pattern.compile("\\b" + label + "\\s*:\\s*([^<\\n]+)", Pattern.CASE_INSENSITIVE)));
        }
    }

    /**
     * @param html page body
     * @return every field that could be read
     * @throws VerificationUnavailableException if the page is blank or no field could be read
     */
    public ObservedPanchang parse(final String html) {
        if (html == null || html.isBlank()) {
            throw new VerificationUnavailableException("Empty page from secondary source");
        }

        final var fields = new EnumMap<PanchangField, String>(PanchangField.class);
        for (final var field : PanchangField.values()) {
            extract(html, PATTERNS.get(field)).ifPresent(value -> fields.put(field, value));
        }

        if (fields.isEmpty()) {
            throw new VerificationUnavailableException("No Panchang elements found in secondary source page");
        }
        log.debug("Parsed {} of {} fields from secondary source: {}", fields.size(), PanchangField.values().length, fields);
        return new ObservedPanchang(fields);
    }

    private static Optional<String> extract(final String html, final List<Pattern> patterns) {
        for (final var pattern : patterns) {
            final var matcher = pattern.matcher(html);
            while (matcher.find()) {
                final var value = clean(matcher.group(1));
                if (!value.isEmpty() && value.length() <= MAX_VALUE_LENGTH) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    static String clean(final String raw) {
        final var text = TAG.matcher(raw).replaceAll(" ")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
