package io.github.jakubt4.panchang.controller;

import io.github.jakubt4.panchang.dto.ErrorResponse;
import io.github.jakubt4.panchang.dto.PanchangRecord;
import io.github.jakubt4.panchang.service.InvalidPanchangInputException;
import io.github.jakubt4.panchang.service.PanchangService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * REST endpoint for Panchang computation.
 *
 * <p>{@code GET /api/panchang?date=2024-04-19&lat=28.6139&lon=77.2090[&city=Delhi][&tz=+05:30]}
 * returns the full record for the date, evaluated at the configured reference time unless the
 * date carries a time of day.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PanchangController {

    private final PanchangService panchangService;

    /**
     * @return {@code 200 OK} with the record, {@code 400 Bad Request} with a REJECTED body on invalid input
     */
    @GetMapping("/panchang")
    public ResponseEntity<PanchangRecord> panchang(@RequestParam final String date,
                                                   @RequestParam final double lat,
                                                   @RequestParam final double lon,
                                                   @RequestParam(required = false) final String city,
                                                   @RequestParam(required = false) final String tz) {
        return ResponseEntity.ok(panchangService.computePanchang(date, lat, lon, city, tz));
    }

    @ExceptionHandler(InvalidPanchangInputException.class)
    ResponseEntity<ErrorResponse> rejectInvalidInput(final InvalidPanchangInputException e) {
        log.info("Rejected Panchang request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.rejected(e.getMessage()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    ResponseEntity<ErrorResponse> rejectMissingParameter(final MissingServletRequestParameterException e) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.rejected("Parameter '" + e.getParameterName() + "' is required"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    ResponseEntity<ErrorResponse> rejectMalformedParameter(final MethodArgumentTypeMismatchException e) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.rejected("Parameter '" + e.getName() + "' is not a valid number"));
    }
}
