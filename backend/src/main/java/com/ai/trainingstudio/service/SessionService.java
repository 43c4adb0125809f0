package com.ai.trainingstudio.service;

import com.ai.trainingstudio.client.BackendGateway;
import com.ai.trainingstudio.dto.DocumentsResponse;
import com.ai.trainingstudio.dto.HealthStatus;
import com.ai.trainingstudio.dto.LocationSuggestion;
import com.ai.trainingstudio.dto.PersonalizationDefaults;
import com.ai.trainingstudio.dto.SessionOverview;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Optional;

/**
 * Session-wide state the UI draws its header and selectors from: the
 * knowledge-base catalogue, the service's dataset counters, and the startup
 * sequence that fills them.
 *
 * <h3>Startup</h3>
 * <ol>
 * <li>{@code GET /get_documents} and {@code GET /health} in parallel. A
 * failing health check is tolerated; a failing catalogue becomes the
 * session's error message.</li>
 * <li>Health counters seed the readiness flags.</li>
 * <li>The IP location lookup runs whatever happened above.</li>
 * </ol>
 */
@Slf4j
@Service
public class SessionService {

    private static final String BOOTSTRAP_FAILURE_MESSAGE = "Unable to load initial data.";

    private final BackendGateway gateway;
    private final ConfigurationStatusTracker configuration;
    private final LocationResolver locationResolver;
    private final Scheduler sessionScheduler;
    private final StudioEventPublisher events;

    @Value("${studio.bootstrap.enabled:true}")
    private boolean bootstrapEnabled = true;

    private volatile List<String> documents = List.of();
    private volatile HealthStatus health;
    private volatile boolean loading;
    private volatile String error;

    public SessionService(BackendGateway gateway, ConfigurationStatusTracker configuration,
            LocationResolver locationResolver, Scheduler sessionScheduler, StudioEventPublisher events) {
        this.gateway = gateway;
        this.configuration = configuration;
        this.locationResolver = locationResolver;
        this.sessionScheduler = sessionScheduler;
        this.events = events;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!bootstrapEnabled) {
            log.info("Session bootstrap disabled");
            return;
        }
        bootstrap().subscribe(
                overview -> log.info("Session ready: {} documents, location {}",
                        overview.getDocuments().size(), overview.getLocationDescription()),
                failure -> log.error("Session bootstrap failed: {}", failure.getMessage(), failure));
    }

    /**
     * Catalogue + health, then the IP location lookup. Never errors.
     */
    public Mono<SessionOverview> bootstrap() {
        return refresh()
                .then(Mono.defer(locationResolver::resolveFromIp))
                .map(ignored -> overview());
    }

    /**
     * Re-reads the document catalogue and the dataset counters. Never errors;
     * a failure ends up in {@link SessionOverview#getError()}.
     */
    public Mono<SessionOverview> refresh() {
        return Mono.defer(() -> {
            Mono<DocumentsResponse> catalogue = gateway.getStructured("/get_documents", DocumentsResponse.class);
            Mono<Optional<HealthStatus>> healthCheck = gateway.getStructured("/health", HealthStatus.class)
                    .map(Optional::of)
                    .onErrorResume(failure -> {
                        log.warn("Health check failed, readiness keeps its current flags: {}",
                                failure.getMessage());
                        return Mono.just(Optional.empty());
                    });

            loading = true;
            error = null;
            publish();
            return Mono.zip(catalogue, healthCheck)
                    .publishOn(sessionScheduler)
                    .map(results -> {
                        applyCatalogue(results.getT1());
                        results.getT2().ifPresent(this::applyHealth);
                        return overview();
                    })
                    .onErrorResume(failure -> {
                        String message = failure.getMessage();
                        error = message != null && !message.isBlank() ? message : BOOTSTRAP_FAILURE_MESSAGE;
                        log.error("Loading the document catalogue failed: {}", error);
                        return Mono.just(overview());
                    })
                    .doOnNext(ignored -> {
                        loading = false;
                        publish();
                    });
        }).subscribeOn(sessionScheduler);
    }

    public List<String> documents() {
        return documents;
    }

    public SessionOverview overview() {
        LocationSuggestion location = locationResolver.current();
        return SessionOverview.builder()
                .loading(loading)
                .error(error)
                .documents(documents)
                .readiness(configuration.readiness())
                .health(health)
                .location(location)
                .locationDescription(location.describe())
                .defaults(PersonalizationDefaults.from(location))
                .languages(SessionOverview.LANGUAGES)
                .build();
    }

    private void applyCatalogue(DocumentsResponse response) {
        List<String> titles = response.getDocuments() != null ? List.copyOf(response.getDocuments()) : List.of();
        documents = titles;
        configuration.updateDocumentCount(titles.size());
        log.info("Loaded {} knowledge base documents", titles.size());
    }

    private void applyHealth(HealthStatus status) {
        health = status;
        configuration.applyHealth(status);
    }

    private void publish() {
        events.sessionChanged(overview());
    }
}
