package io.github.jakubt4.panchang.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Fetches the rendered day-Panchang page of a third-party almanac, used only to cross-check
 * computed results.
 */
@Slf4j
@Service
public class DrikPanchangClient {

    public static final String DAY_PANCHANG_PATH = "/panchang/day-panchang.html";

    private static final DateTimeFormatter DATE_PARAM = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final String BROWSER_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private final RestClient restClient;
    private final String baseUrl;

    public DrikPanchangClient(final RestClient.Builder restClientBuilder,
                              @Value("${panchang.verification.base-url:https://www.drikpanchang.com}") final String baseUrl) {
        this.baseUrl = baseUrl;
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.USER_AGENT, BROWSER_USER_AGENT)
                .build();
    }

    /**
     * GETs the day page for a date and city. One retry on transport or HTTP errors.
     *
     * @return page body, or empty when the server answered without one
     */
    @Retryable(retryFor = RestClientException.class, maxAttempts = 2,
               backoff = @Backoff(delay = 250))
    public Optional<String> fetchDayPanchang(final LocalDate date, final String city) {
        log.debug("Fetching day Panchang for {} / {} from {}", date, city, baseUrl);

        final var body = restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(DAY_PANCHANG_PATH)
                        .queryParam("date", date.format(DATE_PARAM))
                        .queryParam("city", city)
                        .queryParam("lang", "en")
                        .build())
                .accept(MediaType.TEXT_HTML)
                .retrieve()
                .body(String.class);

        return Optional.ofNullable(body);
    }

    @Recover
    public Optional<String> recoverFetchDayPanchang(final RestClientException e,
                                                    final LocalDate date, final String city) {
        log.warn("Failed to fetch day Panchang for {} / {} after retry: {}", date, city, e.getMessage());
        return Optional.empty();
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
