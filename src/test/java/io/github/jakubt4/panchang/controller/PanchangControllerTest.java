package io.github.jakubt4.panchang.controller;

import io.github.jakubt4.panchang.dto.Location;
import io.github.jakubt4.panchang.dto.PanchangRecord;
import io.github.jakubt4.panchang.service.InvalidPanchangInputException;
import io.github.jakubt4.panchang.service.PanchangService;
import io.github.jakubt4.panchang.service.element.ElementKind;
import io.github.jakubt4.panchang.service.element.Paksha;
import io.github.jakubt4.panchang.service.element.PanchangElement;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PanchangController.class)
class PanchangControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PanchangService panchangService;

    @Test
    void panchangReturnsRecordForValidQuery() throws Exception {
        final var record = PanchangRecord.builder()
                .date(LocalDate.of(2024, 4, 19))
                .instant(OffsetDateTime.parse("2024-04-19T06:00:00+05:30"))
                .location(new Location(28.6139, 77.209, "+05:30", "Delhi"))
                .tithi(PanchangElement.builder()
                        .kind(ElementKind.TITHI)
                        .index(11)
                        .name("Ekadashi")
                        .paksha(Paksha.SHUKLA)
                        .endTime(OffsetDateTime.parse("2024-04-19T22:23:00+05:30"))
                        .build())
                .build();
        when(panchangService.computePanchang("2024-04-19", 28.6139, 77.209, "Delhi", "+05:30")).thenReturn(record);

        mockMvc.perform(get("/api/panchang")
                        .param("date", "2024-04-19")
                        .param("lat", "28.6139")
                        .param("lon", "77.2090")
                        .param("city", "Delhi")
                        .param("tz", "+05:30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2024-04-19"))
                .andExpect(jsonPath("$.instant").value("2024-04-19T06:00:00+05:30"))
                .andExpect(jsonPath("$.location.city").value("Delhi"))
                .andExpect(jsonPath("$.tithi.name").value("Ekadashi"))
                .andExpect(jsonPath("$.tithi.paksha").value("Shukla Paksha"))
                .andExpect(jsonPath("$.tithi.endTime").value("2024-04-19T22:23:00+05:30"));
    }

    @Test
    void panchangReturnsBadRequestForInvalidInput() throws Exception {
        when(panchangService.computePanchang(anyString(), anyDouble(), anyDouble(), any(), any()))
                .thenThrow(new InvalidPanchangInputException("Latitude must be within [-90, 90], got 95.0"));

        mockMvc.perform(get("/api/panchang")
                        .param("date", "2024-04-19")
                        .param("lat", "95")
                        .param("lon", "77.2"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.message").value(containsString("Latitude")));
    }

    @Test
    void panchangReturnsBadRequestWhenDateIsMissing() throws Exception {
        mockMvc.perform(get("/api/panchang")
                        .param("lat", "28.6")
                        .param("lon", "77.2"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.message").value(containsString("date")));

        verifyNoInteractions(panchangService);
    }

    @Test
    void panchangReturnsBadRequestForNonNumericCoordinate() throws Exception {
        mockMvc.perform(get("/api/panchang")
                        .param("date", "2024-04-19")
                        .param("lat", "north")
                        .param("lon", "77.2"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.message").value(containsString("lat")));
    }
}
