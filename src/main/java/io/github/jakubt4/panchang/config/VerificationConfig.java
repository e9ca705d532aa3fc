package io.github.jakubt4.panchang.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Worker pool for the secondary-source fetch, kept off the request threads so the wait can be bounded.
 * The queue is bounded; submissions beyond it are rejected.
 */
@Configuration
public class VerificationConfig {

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService verificationExecutor(@Value("${panchang.verification.threads:4}") final int threads,
                                         @Value("${panchang.verification.queue-capacity:16}") final int queueCapacity) {
        final var threadFactory = new CustomizableThreadFactory("panchang-verify-");
        threadFactory.setDaemon(true);
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), threadFactory, new ThreadPoolExecutor.AbortPolicy());
    }
}
