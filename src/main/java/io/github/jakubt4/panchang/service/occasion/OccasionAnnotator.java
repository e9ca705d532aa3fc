package io.github.jakubt4.panchang.service.occasion;

import io.github.jakubt4.panchang.service.element.Masa;
import io.github.jakubt4.panchang.service.element.Paksha;
import io.github.jakubt4.panchang.service.element.TithiName;
import io.github.jakubt4.panchang.service.element.Vara;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Rule table from (tithi, masa, weekday) to the day's festivals and vrats.
 *
 * <p>Festivals come from the masa table and fire on a specific paksha and day of the fortnight.
 * Vrats come from recurring tithis, from tithi/weekday combinations and from the weekday alone.
 * Festivals are listed before vrats; duplicates are dropped.
 */
@Component
public class OccasionAnnotator {

    private static final Map<Masa, List<FestivalRule>> FESTIVALS = new EnumMap<>(Masa.class);
    private static final String[] WEEKLY_VRATS = {
            "Ravivar Vrat", "Somvar Vrat", "Mangalvar Vrat", "Budhvar Vrat",
            "Guruvar Vrat", "Shukravar Vrat", "Shanivar Vrat"
    };

    static {
        festivals(Masa.CHAITRA,
                new FestivalRule(Paksha.SHUKLA, 1, "Chaitra Navratri begins"),
                new FestivalRule(Paksha.SHUKLA, 9, "Ram Navami"),
                new FestivalRule(Paksha.SHUKLA, 15, "Hanuman Jayanti"));
        festivals(Masa.VAISHAKHA,
                new FestivalRule(Paksha.SHUKLA, 3, "Akshaya Tritiya"),
                new FestivalRule(Paksha.SHUKLA, 15, "Buddha Purnima"));
        festivals(Masa.JYESHTHA,
                new FestivalRule(Paksha.SHUKLA, 10, "Ganga Dussehra"),
                new FestivalRule(Paksha.SHUKLA, 11, "Nirjala Ekadashi"));
        festivals(Masa.ASHADHA,
                new FestivalRule(Paksha.SHUKLA, 2, "Jagannath Rath Yatra"),
                new FestivalRule(Paksha.SHUKLA, 11, "Devshayani Ekadashi"),
                new FestivalRule(Paksha.SHUKLA, 15, "Guru Purnima"));
        festivals(Masa.SHRAVANA,
                new FestivalRule(Paksha.SHUKLA, 5, "Nag Panchami"),
                new FestivalRule(Paksha.SHUKLA, 15, "Raksha Bandhan"),
                new FestivalRule(Paksha.KRISHNA, 8, "Krishna Janmashtami"));
        festivals(Masa.BHADRAPADA,
                new FestivalRule(Paksha.SHUKLA, 4, "Ganesh Chaturthi"),
                new FestivalRule(Paksha.SHUKLA, 14, "Anant Chaturdashi"),
                new FestivalRule(Paksha.KRISHNA, 1, "Pitru Paksha begins"),
                new FestivalRule(Paksha.KRISHNA, 15, "Sarva Pitru Amavasya"));
        festivals(Masa.ASHWIN,
                new FestivalRule(Paksha.SHUKLA, 1, "Sharad Navratri begins"),
                new FestivalRule(Paksha.SHUKLA, 10, "Dussehra"),
                new FestivalRule(Paksha.SHUKLA, 15, "Sharad Purnima"),
                new FestivalRule(Paksha.KRISHNA, 4, "Karva Chauth"),
                new FestivalRule(Paksha.KRISHNA, 13, "Dhanteras"),
                new FestivalRule(Paksha.KRISHNA, 15, "Diwali"));
        festivals(Masa.KARTIKA,
                new FestivalRule(Paksha.SHUKLA, 1, "Govardhan Puja"),
                new FestivalRule(Paksha.SHUKLA, 2, "Bhai Dooj"),
                new FestivalRule(Paksha.SHUKLA, 6, "Chhath Puja"),
                new FestivalRule(Paksha.SHUKLA, 11, "Devutthana Ekadashi"),
                new FestivalRule(Paksha.SHUKLA, 15, "Kartik Purnima"));
        festivals(Masa.MARGASHIRSHA,
                new FestivalRule(Paksha.SHUKLA, 5, "Vivah Panchami"),
                new FestivalRule(Paksha.SHUKLA, 11, "Gita Jayanti"));
        festivals(Masa.PAUSHA,
                new FestivalRule(Paksha.SHUKLA, 15, "Paush Purnima"));
        festivals(Masa.MAGHA,
                new FestivalRule(Paksha.SHUKLA, 5, "Vasant Panchami"),
                new FestivalRule(Paksha.KRISHNA, 14, "Maha Shivaratri"));
        festivals(Masa.PHALGUNA,
                new FestivalRule(Paksha.SHUKLA, 15, "Holika Dahan"),
                new FestivalRule(Paksha.KRISHNA, 1, "Holi"));
    }

    /**
     * @param tithiIndex tithi of the lunar month, 1..30
     * @param masa       amanta lunar month
     * @param weekday    civil weekday
     * @return occasions in rule order, never {@code null}
     */
    public List<Occasion> occasions(final int tithiIndex, final Masa masa, final DayOfWeek weekday) {
        final var paksha = Paksha.ofTithi(tithiIndex);
        final var day = TithiName.dayOfPaksha(tithiIndex);
        final var tithi = TithiName.ofIndex(tithiIndex);
        final var occasions = new LinkedHashSet<Occasion>();

        for (final var rule : FESTIVALS.getOrDefault(masa, List.of())) {
            if (rule.paksha() == paksha && rule.day() == day) {
                occasions.add(Occasion.festival(rule.name()));
            }
        }

        switch (tithi) {
            case EKADASHI -> occasions.add(Occasion.vrat("Ekadashi Vrat"));
            case CHATURTHI -> {
                if (paksha == Paksha.SHUKLA) {
                    occasions.add(Occasion.vrat("Vinayaka Chaturthi"));
                } else {
                    occasions.add(Occasion.vrat(weekday == DayOfWeek.TUESDAY ? "Angaraki Sankashti" : "Sankashti Chaturthi"));
                }
            }
            case TRAYODASHI -> occasions.add(Occasion.vrat(pradoshName(weekday)));
            case CHATURDASHI -> {
                if (paksha == Paksha.KRISHNA) {
                    occasions.add(Occasion.vrat("Masik Shivaratri"));
                }
            }
            case PURNIMA -> occasions.add(Occasion.vrat("Purnima Vrat"));
            case AMAVASYA -> occasions.add(Occasion.vrat("Amavasya"));
            default -> {
                // no tithi-bound vrat
            }
        }

        occasions.add(Occasion.vrat(WEEKLY_VRATS[Vara.sundayFirstIndex(weekday)]));
        return new ArrayList<>(occasions);
    }

    private static String pradoshName(final DayOfWeek weekday) {
        return switch (weekday) {
            case MONDAY -> "Soma Pradosh Vrat";
            case TUESDAY -> "Bhauma Pradosh Vrat";
            case SATURDAY -> "Shani Pradosh Vrat";
            default -> "Pradosh Vrat";
        };
    }

    private static void festivals(final Masa masa, final FestivalRule... rules) {
        FESTIVALS.put(masa, List.of(rules));
    }

    private record FestivalRule(Paksha paksha, int day, String name) {
    }
}
