package io.github.jakubt4.panchang.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DrikPanchangClientTest {

    private static final String BASE_URL = "http://localhost:8091";
    private static final LocalDate DATE = LocalDate.of(2024, 4, 19);

    private DrikPanchangClient client;
    private MockRestServiceServer mockServer;

    @BeforeEach
    void setUp() {
        final var restTemplate = new RestTemplate();
        mockServer = MockRestServiceServer.bindTo(restTemplate).build();

        final var builder = RestClient.builder()
                .requestFactory(restTemplate.getRequestFactory());

        client = new DrikPanchangClient(builder, BASE_URL);
    }

    @Test
    void fetchDayPanchangRequestsTheDayPageForDateAndCity() {
        mockServer.expect(requestTo(startsWith(BASE_URL + DrikPanchangClient.DAY_PANCHANG_PATH)))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("date", "19/04/2024"))
                .andExpect(queryParam("city", "Varanasi"))
                .andExpect(queryParam("lang", "en"))
                .andExpect(header(HttpHeaders.USER_AGENT, containsString("Mozilla")))
                .andRespond(withSuccess("<html>Tithi: Ekadashi</html>", MediaType.TEXT_HTML));

        final var page = client.fetchDayPanchang(DATE, "Varanasi");

        assertThat(page).contains("<html>Tithi: Ekadashi</html>");
        mockServer.verify();
    }

    @Test
    void fetchDayPanchangThrowsOnServerError() {
        mockServer.expect(requestTo(startsWith(BASE_URL + DrikPanchangClient.DAY_PANCHANG_PATH)))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchDayPanchang(DATE, "Varanasi"))
                .isInstanceOf(HttpServerErrorException.class);
    }

    @Test
    void recoveryReturnsEmptyPage() {
        final var recovered = client.recoverFetchDayPanchang(
                new ResourceAccessException("Read timed out"), DATE, "Varanasi");

        assertThat(recovered).isEmpty();
    }
}
