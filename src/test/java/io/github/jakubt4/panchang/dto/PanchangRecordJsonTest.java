package io.github.jakubt4.panchang.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.panchang.service.GeoCoordinate;
import io.github.jakubt4.panchang.service.PanchangCalculator;
import io.github.jakubt4.panchang.service.element.ElementResolver;
import io.github.jakubt4.panchang.service.ephemeris.Ayanamsa;
import io.github.jakubt4.panchang.service.ephemeris.LowPrecisionEphemeris;
import io.github.jakubt4.panchang.service.muhurat.MuhuratScheduler;
import io.github.jakubt4.panchang.service.occasion.OccasionAnnotator;
import io.github.jakubt4.panchang.service.solar.SolarClock;
import io.github.jakubt4.panchang.service.verification.Verification;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.JsonTest;

import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@JsonTest
class PanchangRecordJsonTest {

    @Autowired
    private ObjectMapper objectMapper;

    private final PanchangCalculator calculator = new PanchangCalculator(new LowPrecisionEphemeris(Ayanamsa.LAHIRI),
            new ElementResolver(), new SolarClock(), new MuhuratScheduler(), new OccasionAnnotator());

    @Test
    void civilTimesKeepTheLocationOffset() throws Exception {
        final var record = calculator.compute(OffsetDateTime.parse("2024-04-19T06:00:00+05:30"),
                new GeoCoordinate(28.6139, 77.2090), "Delhi");

        final var json = objectMapper.readTree(objectMapper.writeValueAsString(record));

        assertThat(json.get("date").asText()).isEqualTo("2024-04-19");
        assertThat(json.get("instant").asText()).isEqualTo("2024-04-19T06:00:00+05:30");
        assertThat(json.at("/solarTimes/sunrise").asText()).endsWith("+05:30");
        assertThat(json.at("/tithi/endTime").asText()).endsWith("+05:30");
        assertThat(json.at("/solarTimes/dayLength").asText()).startsWith("PT");
        assertThat(json.at("/muhurats/0/label").asText()).isEqualTo("Brahma Muhurat");
    }

    @Test
    void enumsSerializeAsTheirDisplayNames() throws Exception {
        final var record = calculator.compute(OffsetDateTime.parse("2024-04-19T06:00:00+05:30"),
                new GeoCoordinate(28.6139, 77.2090), null);

        final var json = objectMapper.readTree(objectMapper.writeValueAsString(record));

        assertThat(json.at("/tithi/paksha").asText()).endsWith("Paksha");
        assertThat(json.at("/calendar/masa").asText()).isEqualTo(record.calendar().masa().getDisplayName());
        assertThat(json.at("/provenance/ayanamsa").asText()).isEqualTo("LAHIRI");
        assertThat(json.at("/nakshatra").has("paksha")).isFalse();
    }

    @Test
    void polarSolarTimesOmitSunriseAndSunset() throws Exception {
        final var record = calculator.compute(OffsetDateTime.parse("2024-12-21T06:00:00Z"),
                new GeoCoordinate(85.0, 0.0), null);

        final var json = objectMapper.readTree(objectMapper.writeValueAsString(record.solarTimes()));

        assertThat(json.get("daylight").asText()).isEqualTo("POLAR_NIGHT");
        assertThat(json.has("sunrise")).isFalse();
        assertThat(json.has("polar")).isFalse();
        assertThat(json.has("solarNoon")).isTrue();
    }

    @Test
    void verificationOutcomeIsEmbeddedInProvenance() throws Exception {
        final var record = calculator.compute(OffsetDateTime.parse("2024-04-19T06:00:00+05:30"),
                        new GeoCoordinate(28.6139, 77.2090), null)
                .withVerification(Verification.unavailable("Secondary source timed out after 8000 ms"));

        final var json = objectMapper.readTree(objectMapper.writeValueAsString(record));

        assertThat(json.at("/provenance/verified").asBoolean()).isFalse();
        assertThat(json.at("/provenance/verification/status").asText()).isEqualTo("UNAVAILABLE");
        assertThat(json.at("/provenance/verification/reason").asText()).contains("timed out");
        assertThat(json.at("/provenance/verification").has("source")).isFalse();
    }
}
