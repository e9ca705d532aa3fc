package io.github.jakubt4.panchang.service.occasion;

/**
 * A festival or vrat (observance) falling on the day.
 */
public record Occasion(String name, Kind kind) {

    public enum Kind {
        FESTIVAL,
        VRAT
    }

    static Occasion festival(final String name) {
        return new Occasion(name, Kind.FESTIVAL);
    }

    static Occasion vrat(final String name) {
        return new Occasion(name, Kind.VRAT);
    }
}
