package com.ai.trainingstudio.controller;

import com.ai.trainingstudio.dto.GeolocationReport;
import com.ai.trainingstudio.dto.LocationSuggestion;
import com.ai.trainingstudio.dto.SessionOverview;
import com.ai.trainingstudio.service.LocationResolver;
import com.ai.trainingstudio.service.SessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/session")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class SessionController {

    private final SessionService sessionService;
    private final LocationResolver locationResolver;

    @GetMapping
    public SessionOverview overview() {
        return sessionService.overview();
    }

    @PostMapping("/refresh")
    public Mono<SessionOverview> refresh() {
        return sessionService.refresh();
    }

    /**
     * Receives the outcome of the browser geolocation prompt: coordinates, or
     * the sensor's failure code.
     */
    @PostMapping("/location/browser")
    public Mono<LocationSuggestion> reportBrowserLocation(@Valid @RequestBody GeolocationReport report) {
        log.info("Browser geolocation reported: {}", report.hasCoordinates() ? "coordinates" : report.getError());
        return locationResolver.reportBrowserResult(report);
    }
}
