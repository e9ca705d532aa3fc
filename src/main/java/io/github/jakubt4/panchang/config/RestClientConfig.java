package io.github.jakubt4.panchang.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;

@Configuration
public class RestClientConfig {

    @Bean
    RestClientCustomizer restClientCustomizer(
            @Value("${panchang.http.connect-timeout-ms:5000}") final long connectTimeoutMs,
            @Value("${panchang.http.read-timeout-ms:8000}") final long readTimeoutMs) {
        return builder -> {
            final var requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(Duration.ofMillis(connectTimeoutMs));
            requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));
            builder.requestFactory(requestFactory);
        };
    }
}
