package com.ai.trainingstudio.service;

import com.ai.trainingstudio.dto.GeolocationReport;
import com.ai.trainingstudio.dto.GeolocationReport.Failure;
import com.ai.trainingstudio.dto.LocationSuggestion;
import com.ai.trainingstudio.dto.LocationSuggestion.Provenance;
import com.ai.trainingstudio.dto.PersonalizationDefaults;
import com.ai.trainingstudio.support.StubBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class LocationResolverTest {

    private static final String DETECT = "/detect_location";

    private static final String MAHARASHTRA = "{\"location\":{\"city\":\"Mumbai\",\"state\":\"Maharashtra\","
            + "\"country\":\"India\",\"detected\":true},\"suggested_language\":\"Marathi\"}";

    private static final String KARNATAKA = "{\"location\":{\"city\":\"Bengaluru\",\"state\":\"Karnataka\","
            + "\"country\":\"India\",\"detected\":true},\"suggested_language\":\"Kannada\"}";

    private StubBackend backend;
    private LocationResolver resolver;

    @BeforeEach
    void setUp() {
        backend = new StubBackend();
        resolver = new LocationResolver(backend.gateway(), Schedulers.immediate(),
                mock(StudioEventPublisher.class));
    }

    @Test
    void should_KeepIpRegion_When_BrowserPermissionIsDenied() {
        backend.onJson(DETECT, MAHARASHTRA);

        resolver.resolveFromIp().block();
        LocationSuggestion result = resolver.reportBrowserResult(
                GeolocationReport.failure(Failure.PERMISSION_DENIED)).block();

        assertEquals("Maharashtra", result.getRegion());
        assertEquals(Provenance.IP, result.getProvenance());
        assertTrue(result.isPermissionDenied());
        assertEquals("Marathi", resolver.currentDefaults().getSuggestedLanguage());
        assertEquals(1, backend.requestsTo(DETECT));
    }

    @Test
    void should_UseDefaults_When_IpLookupFails() {
        backend.on(DETECT, () -> Mono.just(StubBackend.text(HttpStatus.BAD_GATEWAY, "ipapi down")));

        LocationSuggestion result = resolver.resolveFromIp().block();

        assertEquals(Provenance.UNKNOWN, result.getProvenance());
        assertFalse(result.isDetected());
        assertEquals(PersonalizationDefaults.FALLBACK, resolver.currentDefaults());
        assertEquals("English", resolver.currentDefaults().getSuggestedLanguage());
        assertEquals("Corporate", resolver.currentDefaults().getSuggestedRegion());
    }

    @Test
    void should_OverrideIpSuggestion_When_BrowserReportsCoordinates() {
        backend.onJson(DETECT, MAHARASHTRA);
        backend.onJson(DETECT, KARNATAKA);

        resolver.resolveFromIp().block();
        LocationSuggestion result = resolver.reportBrowserResult(
                GeolocationReport.coordinates(12.97, 77.59)).block();

        assertEquals("Karnataka", result.getRegion());
        assertEquals(Provenance.BROWSER, result.getProvenance());
        assertEquals("Detected: Bengaluru, Karnataka (browser)", result.describe());
        assertEquals("Kannada", resolver.currentDefaults().getSuggestedLanguage());
    }

    @Test
    void should_NotEraseSuggestion_When_LaterLookupFails() {
        backend.onJson(DETECT, MAHARASHTRA);
        backend.on(DETECT, () -> Mono.just(StubBackend.json(HttpStatus.INTERNAL_SERVER_ERROR,
                "{\"error\":\"reverse geocoding failed\"}")));

        resolver.resolveFromIp().block();
        LocationSuggestion result = resolver.reportBrowserResult(
                GeolocationReport.coordinates(19.07, 72.87)).block();

        assertEquals("Maharashtra", result.getRegion());
        assertEquals(Provenance.IP, result.getProvenance());
        assertEquals("Maharashtra", resolver.current().getRegion());
    }

    @Test
    void should_NotReplaceBrowserSuggestion_When_IpAnswersLater() {
        backend.onJson(DETECT, KARNATAKA);
        backend.onJson(DETECT, MAHARASHTRA);

        resolver.reportBrowserResult(GeolocationReport.coordinates(12.97, 77.59)).block();
        LocationSuggestion result = resolver.resolveFromIp().block();

        assertEquals("Karnataka", result.getRegion());
        assertEquals(Provenance.BROWSER, result.getProvenance());
    }

    @Test
    void should_IgnoreSensorTimeout() {
        backend.onJson(DETECT, MAHARASHTRA);
        resolver.resolveFromIp().block();

        LocationSuggestion result = resolver.reportBrowserResult(GeolocationReport.failure(Failure.TIMEOUT)).block();

        assertFalse(result.isPermissionDenied());
        assertEquals(Provenance.IP, result.getProvenance());
    }

    @Test
    void should_SkipLookup_When_CoordinatesAreOutOfRange() {
        LocationSuggestion result = resolver.reportBrowserResult(GeolocationReport.coordinates(123.0, 10.0)).block();

        assertEquals(Provenance.UNKNOWN, result.getProvenance());
        assertEquals(0, backend.requests().size());
    }
}
