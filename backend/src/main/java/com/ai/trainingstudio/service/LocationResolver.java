package com.ai.trainingstudio.service;

import com.ai.trainingstudio.client.BackendGateway;
import com.ai.trainingstudio.dto.GeolocationReport;
import com.ai.trainingstudio.dto.LocationData;
import com.ai.trainingstudio.dto.LocationSuggestion;
import com.ai.trainingstudio.dto.LocationSuggestion.Provenance;
import com.ai.trainingstudio.dto.PersonalizationDefaults;
import com.ai.trainingstudio.workflow.PersonalizationSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Map;

/**
 * Resolves the suggested language and region from the user's location.
 *
 * <p>
 * Two lookups feed the same suggestion:
 * <ul>
 * <li><b>IP</b>: runs once at startup. On failure the suggestion stays as it
 * was (provenance UNKNOWN if nothing succeeded yet); no error reaches the
 * user.</li>
 * <li><b>Browser</b>: runs when the UI reports sensor coordinates and
 * overwrites the suggestion with provenance BROWSER. A sensor refusal only
 * raises {@code permissionDenied}.</li>
 * </ul>
 * A failure never erases an earlier success, and an IP answer never replaces
 * a browser one.
 */
@Slf4j
@Service
public class LocationResolver implements PersonalizationSource {

    private static final String DETECT_PATH = "/detect_location";

    private final BackendGateway gateway;
    private final Scheduler sessionScheduler;
    private final StudioEventPublisher events;

    private volatile LocationSuggestion suggestion = LocationSuggestion.unknown();

    public LocationResolver(BackendGateway gateway, Scheduler sessionScheduler, StudioEventPublisher events) {
        this.gateway = gateway;
        this.sessionScheduler = sessionScheduler;
        this.events = events;
    }

    public LocationSuggestion current() {
        return suggestion;
    }

    @Override
    public PersonalizationDefaults currentDefaults() {
        return PersonalizationDefaults.from(suggestion);
    }

    public Mono<LocationSuggestion> resolveFromIp() {
        return lookup(Map.of())
                .publishOn(sessionScheduler)
                .map(this::applyIpAnswer)
                .onErrorResume(error -> {
                    log.warn("IP location lookup failed, keeping {} defaults: {}",
                            suggestion.getProvenance(), error.getMessage());
                    return Mono.just(suggestion);
                })
                .subscribeOn(sessionScheduler);
    }

    public Mono<LocationSuggestion> reportBrowserResult(GeolocationReport report) {
        if (report == null || !report.hasCoordinates()) {
            return Mono.fromCallable(() -> onSensorFailure(report == null ? null : report.getError()))
                    .subscribeOn(sessionScheduler);
        }
        double lat = report.getLat();
        double lon = report.getLon();
        if (lat < -90 || lat > 90 || lon < -180 || lon > 180) {
            log.warn("Ignoring out-of-range browser coordinates lat={}, lon={}", lat, lon);
            return Mono.just(suggestion);
        }

        return lookup(Map.of("lat", lat, "lon", lon))
                .publishOn(sessionScheduler)
                .map(this::applyBrowserAnswer)
                .onErrorResume(error -> {
                    log.warn("Browser location lookup failed, keeping {} suggestion: {}",
                            suggestion.getProvenance(), error.getMessage());
                    return Mono.just(suggestion);
                })
                .subscribeOn(sessionScheduler);
    }

    private Mono<LocationData> lookup(Map<String, Object> payload) {
        return gateway.postJson(DETECT_PATH, payload)
                .map(response -> gateway.readPayload(response, LocationData.class));
    }

    // ── Session scheduler ────────────────────────────────────────────────────

    private LocationSuggestion applyIpAnswer(LocationData data) {
        LocationSuggestion current = suggestion;
        if (current.getProvenance() == Provenance.BROWSER) {
            log.info("IP location answer ignored: browser location already applied");
            return current;
        }
        return publish(toSuggestion(data, Provenance.IP, current.isPermissionDenied()));
    }

    private LocationSuggestion applyBrowserAnswer(LocationData data) {
        return publish(toSuggestion(data, Provenance.BROWSER, false));
    }

    private LocationSuggestion onSensorFailure(GeolocationReport.Failure failure) {
        if (failure == GeolocationReport.Failure.PERMISSION_DENIED) {
            log.info("Browser geolocation permission denied; keeping {} suggestion", suggestion.getProvenance());
            return publish(suggestion.withPermissionDenied(true));
        }
        log.info("Browser geolocation unavailable ({}); keeping {} suggestion", failure, suggestion.getProvenance());
        return suggestion;
    }

    private LocationSuggestion publish(LocationSuggestion next) {
        suggestion = next;
        log.info("Location suggestion: {}", next.describe());
        events.sessionChanged(next);
        return next;
    }

    private static LocationSuggestion toSuggestion(LocationData data, Provenance provenance, boolean denied) {
        LocationData.Location location = data.getLocation() != null
                ? data.getLocation()
                : new LocationData.Location();
        return LocationSuggestion.builder()
                .region(location.getState())
                .city(location.getCity())
                .country(location.getCountry())
                .detected(location.isDetected())
                .suggestedLanguage(data.getSuggestedLanguage())
                .provenance(provenance)
                .permissionDenied(denied)
                .build();
    }
}
