package io.github.jakubt4.panchang.service.element;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.DayOfWeek;

/**
 * Weekdays in Sunday-first order, each ruled by its graha.
 */
@Getter
@RequiredArgsConstructor
public enum Vara {

    RAVIVARA("Ravivara", "रविवार", DayOfWeek.SUNDAY, "Sun"),
    SOMAVARA("Somavara", "सोमवार", DayOfWeek.MONDAY, "Moon"),
    MANGALAVARA("Mangalavara", "मङ्गलवार", DayOfWeek.TUESDAY, "Mars"),
    BUDHAVARA("Budhavara", "बुधवार", DayOfWeek.WEDNESDAY, "Mercury"),
    GURUVARA("Guruvara", "गुरुवार", DayOfWeek.THURSDAY, "Jupiter"),
    SHUKRAVARA("Shukravara", "शुक्रवार", DayOfWeek.FRIDAY, "Venus"),
    SHANIVARA("Shanivara", "शनिवार", DayOfWeek.SATURDAY, "Saturn");

    private final String displayName;
    private final String sanskritName;
    private final DayOfWeek dayOfWeek;
    private final String lord;

    /**
     * Sunday-first position of a weekday, 0..6. Shared by every weekday-indexed table.
     */
    public static int sundayFirstIndex(final DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }

    public static Vara of(final DayOfWeek dayOfWeek) {
        return values()[sundayFirstIndex(dayOfWeek)];
    }

    public String englishName() {
        final var name = dayOfWeek.name();
        return name.charAt(0) + name.substring(1).toLowerCase();
    }
}
