package io.github.jakubt4.panchang.service.muhurat;

import io.github.jakubt4.panchang.service.element.Vara;
import io.github.jakubt4.panchang.service.solar.SolarTimes;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives the day's muhurats from its solar times.
 *
 * <p>Daylight is cut into eight equal octants; Rahu, Yamaganda and Gulika each take the octant
 * their weekday table names (1-based, Sunday first). Abhijit spans 24 minutes either side of
 * solar noon. Brahma Muhurat runs from 96 to 48 minutes before sunrise and Amrit Kaal fills the
 * hour before sunrise. Without a sunrise (polar day or night) only Abhijit is produced.
 */
@Component
public class MuhuratScheduler {

    static final int[] RAHU_OCTANTS = {8, 2, 7, 5, 6, 4, 3};
    static final int[] YAMAGANDA_OCTANTS = {5, 4, 3, 2, 1, 7, 6};
    static final int[] GULIKA_OCTANTS = {7, 6, 5, 4, 3, 2, 1};

    /** Noon ± 0.4 h, a 48-minute window. Deliberately not the 24-minute total (noon ± 12 min) some almanacs quote. */
    private static final Duration ABHIJIT_HALF_SPAN = Duration.ofMinutes(24);
    private static final Duration BRAHMA_START = Duration.ofMinutes(96);
    private static final Duration BRAHMA_END = Duration.ofMinutes(48);
    private static final Duration AMRIT_SPAN = Duration.ofHours(1);

    public List<MuhuratWindow> muhuratWindows(final SolarTimes solarTimes, final DayOfWeek weekday) {
        final var windows = new ArrayList<MuhuratWindow>();
        final var noon = solarTimes.solarNoon();

        if (solarTimes.isPolar()) {
            windows.add(MuhuratWindow.of(Muhurat.ABHIJIT_MUHURAT,
                    noon.minus(ABHIJIT_HALF_SPAN), noon.plus(ABHIJIT_HALF_SPAN)));
            return List.copyOf(windows);
        }

        final var sunrise = solarTimes.sunrise();
        final var day = Vara.sundayFirstIndex(weekday);

        windows.add(MuhuratWindow.of(Muhurat.BRAHMA_MUHURAT, sunrise.minus(BRAHMA_START), sunrise.minus(BRAHMA_END)));
        windows.add(MuhuratWindow.of(Muhurat.AMRIT_KAAL, sunrise.minus(AMRIT_SPAN), sunrise));
        windows.add(MuhuratWindow.of(Muhurat.ABHIJIT_MUHURAT,
                noon.minus(ABHIJIT_HALF_SPAN), noon.plus(ABHIJIT_HALF_SPAN)));
        windows.add(octant(Muhurat.RAHU_KAAL, solarTimes, RAHU_OCTANTS[day]));
        windows.add(octant(Muhurat.YAMAGANDA_KAAL, solarTimes, YAMAGANDA_OCTANTS[day]));
        windows.add(octant(Muhurat.GULIKA_KAAL, solarTimes, GULIKA_OCTANTS[day]));
        return List.copyOf(windows);
    }

    private static MuhuratWindow octant(final Muhurat muhurat, final SolarTimes solarTimes, final int octant) {
        final var octantNanos = Duration.between(solarTimes.sunrise(), solarTimes.sunset()).toNanos() / 8;
        final OffsetDateTime start = solarTimes.sunrise().plusNanos(octantNanos * (octant - 1));
        return MuhuratWindow.of(muhurat, start, start.plusNanos(octantNanos));
    }
}
