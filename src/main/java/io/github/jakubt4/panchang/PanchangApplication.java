package io.github.jakubt4.panchang;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Panchang computation engine: the five limbs of the Hindu almanac (Tithi, Vara, Nakshatra, Yoga,
 * Karana), sun timings, muhurats and occasions for any date and place.
 *
 * <p>Results are computed from analytical Sun and Moon series and optionally cross-checked against
 * a published almanac page.
 *
 * @see io.github.jakubt4.panchang.service.PanchangService
 * @see io.github.jakubt4.panchang.service.verification.PanchangVerifier
 */
@SpringBootApplication
@EnableRetry
public class PanchangApplication {

    public static void main(String[] args) {
        SpringApplication.run(PanchangApplication.class, args);
    }
}
