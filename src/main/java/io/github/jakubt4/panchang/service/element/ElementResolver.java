package io.github.jakubt4.panchang.service.element;

import io.github.jakubt4.panchang.service.ephemeris.Angles;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Maps Sun and Moon longitudes to the Panchang elements and the Moon's sign, and estimates
 * when each element ends.
 *
 * <p>End times are linear back-solves: the distance to the element's next boundary divided by
 * the mean daily rate of its governing angle, rounded to the second and expressed in the
 * query instant's UTC offset.
 */
@Component
public class ElementResolver {

    /** Mean daily motion of Moon minus Sun, degrees per day. */
    public static final double ELONGATION_RATE = 12.190749;
    /** Mean daily motion of the Moon, degrees per day. */
    public static final double LUNAR_RATE = 13.176358;
    /** Mean daily motion of the Sun, degrees per day. */
    public static final double SOLAR_RATE = 0.985647;
    /** Mean daily motion of Sun plus Moon, degrees per day. */
    public static final double YOGA_RATE = LUNAR_RATE + SOLAR_RATE;

    static final double TITHI_SPAN = 12.0;
    static final double KARANA_SPAN = 6.0;
    static final double NAKSHATRA_SPAN = Angles.FULL_CIRCLE / 27;
    static final double RASHI_SPAN = 30.0;

    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final String[] PHASES = {
            "New Moon", "Waxing Crescent", "First Quarter", "Waxing Gibbous",
            "Full Moon", "Waning Gibbous", "Last Quarter", "Waning Crescent"
    };

    public ResolvedElements resolveElements(final double sunLongitude, final double moonLongitude,
                                            final OffsetDateTime instant) {
        final var sun = Angles.normalize(sunLongitude);
        final var moon = Angles.normalize(moonLongitude);
        final var elongation = Angles.normalize(moon - sun);
        final var combined = Angles.normalize(sun + moon);

        return new ResolvedElements(
                tithi(elongation, instant),
                nakshatra(moon, instant),
                yoga(combined, instant),
                karana(elongation, instant),
                rashi(moon, instant));
    }

    PanchangElement tithi(final double elongation, final OffsetDateTime instant) {
        final var index = Angles.sector(elongation, TITHI_SPAN, 30) + 1;
        final var name = TithiName.ofIndex(index);

        return PanchangElement.builder()
                .kind(ElementKind.TITHI)
                .index(index)
                .name(name.getDisplayName())
                .sanskritName(name.getSanskritName())
                .paksha(Paksha.ofTithi(index))
                .deity(name.getDeity())
                .nextName(TithiName.ofIndex(index % 30 + 1).getDisplayName())
                .endTime(crossing(instant, elongation, index * TITHI_SPAN, ELONGATION_RATE))
                .build();
    }

    PanchangElement nakshatra(final double moon, final OffsetDateTime instant) {
        final var index = Angles.sector(moon, NAKSHATRA_SPAN, 27);
        final var nakshatra = Nakshatra.ofIndex(index);

        return PanchangElement.builder()
                .kind(ElementKind.NAKSHATRA)
                .index(index)
                .name(nakshatra.getDisplayName())
                .sanskritName(nakshatra.getSanskritName())
                .deity(nakshatra.getDeity())
                .lord(nakshatra.getLord())
                .nextName(Nakshatra.ofIndex(index + 1).getDisplayName())
                .endTime(crossing(instant, moon, (index + 1) * NAKSHATRA_SPAN, LUNAR_RATE))
                .build();
    }

    PanchangElement yoga(final double combined, final OffsetDateTime instant) {
        final var index = Angles.sector(combined, NAKSHATRA_SPAN, 27);
        final var yoga = Yoga.ofIndex(index);

        return PanchangElement.builder()
                .kind(ElementKind.YOGA)
                .index(index)
                .name(yoga.getDisplayName())
                .sanskritName(yoga.getSanskritName())
                .meaning(yoga.getMeaning())
                .nextName(Yoga.ofIndex(index + 1).getDisplayName())
                .endTime(crossing(instant, combined, (index + 1) * NAKSHATRA_SPAN, YOGA_RATE))
                .build();
    }

    PanchangElement karana(final double elongation, final OffsetDateTime instant) {
        final var index = Angles.sector(elongation, KARANA_SPAN, 60);
        final var karana = Karana.ofHalfTithi(index);

        return PanchangElement.builder()
                .kind(ElementKind.KARANA)
                .index(index)
                .name(karana.getDisplayName())
                .sanskritName(karana.getSanskritName())
                .paksha(Paksha.ofTithi(index / 2 + 1))
                .meaning(karana.isMovable() ? "Movable (chara)" : "Fixed (sthira)")
                .nextName(Karana.ofHalfTithi(index + 1).getDisplayName())
                .endTime(crossing(instant, elongation, (index + 1) * KARANA_SPAN, ELONGATION_RATE))
                .build();
    }

    MoonSign rashi(final double moon, final OffsetDateTime instant) {
        final var index = Angles.sector(moon, RASHI_SPAN, 12);
        return MoonSign.of(Rashi.ofIndex(index),
                crossing(instant, moon, (index + 1) * RASHI_SPAN, LUNAR_RATE));
    }

    /**
     * The civil weekday of the instant. It ends at the next local midnight.
     */
    public PanchangElement resolveVara(final OffsetDateTime instant) {
        final var vara = Vara.of(instant.getDayOfWeek());
        final var next = Vara.of(instant.getDayOfWeek().plus(1));

        return PanchangElement.builder()
                .kind(ElementKind.VARA)
                .index(vara.ordinal())
                .name(vara.getDisplayName())
                .sanskritName(vara.getSanskritName())
                .englishName(vara.englishName())
                .lord(vara.getLord())
                .nextName(next.getDisplayName())
                .endTime(instant.toLocalDate().plusDays(1).atStartOfDay().atOffset(instant.getOffset()))
                .build();
    }

    public LunarPhase resolvePhase(final double sunLongitude, final double moonLongitude) {
        final var elongation = Angles.normalize(moonLongitude - sunLongitude);
        final var tithiIndex = Angles.sector(elongation, TITHI_SPAN, 30) + 1;
        final var phase = PHASES[Angles.sector(elongation + 22.5, 45.0, 8)];
        final var illumination = (1 - Angles.cosDeg(elongation)) / 2 * 100;

        return new LunarPhase(Paksha.ofTithi(tithiIndex), phase, FastMath.round(illumination * 10) / 10.0);
    }

    /**
     * Amanta month from the Sun's sign at the preceding new moon, estimated by running the
     * elongation back to zero at its mean rate.
     */
    public LunarCalendar resolveCalendar(final double sunLongitude, final double moonLongitude) {
        final var sun = Angles.normalize(sunLongitude);
        final var elongation = Angles.normalize(moonLongitude - sun);
        final var daysSinceNewMoon = elongation / ELONGATION_RATE;
        final var sunAtNewMoon = Angles.normalize(sun - daysSinceNewMoon * SOLAR_RATE);

        final var masa = Masa.startingInSign(Angles.sector(sunAtNewMoon, RASHI_SPAN, 12));
        final var sunSign = Angles.sector(sun, RASHI_SPAN, 12);
        // Makara (9) through Mithuna (2)
        final var ayana = sunSign >= 9 || sunSign <= 2 ? "Uttarayana" : "Dakshinayana";

        return new LunarCalendar(masa, ayana, masa.ritu());
    }

    /**
     * Instant at which {@code angle}, advancing at {@code ratePerDay}, reaches {@code boundary}.
     */
    static OffsetDateTime crossing(final OffsetDateTime instant, final double angle,
                                   final double boundary, final double ratePerDay) {
        final var days = FastMath.max(0.0, (boundary - angle) / ratePerDay);
        final var exact = instant.plusNanos(FastMath.round(days * SECONDS_PER_DAY * 1.0e9));
        final var rounded = exact.plusNanos(500_000_000L).truncatedTo(ChronoUnit.SECONDS);
        return rounded.isBefore(instant) ? instant : rounded;
    }
}
