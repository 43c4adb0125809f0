package com.ai.trainingstudio.service;

import com.ai.trainingstudio.client.BackendGateway;
import com.ai.trainingstudio.client.BackendResponse;
import com.ai.trainingstudio.dto.ConfigurationOverview;
import com.ai.trainingstudio.dto.HealthStatus;
import com.ai.trainingstudio.dto.OperationView;
import com.ai.trainingstudio.dto.ReadinessStatus;
import com.ai.trainingstudio.exception.BackendRequestException;
import com.ai.trainingstudio.workflow.ReadinessSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks the three dataset uploads and the readiness they unlock.
 *
 * <p>
 * Each upload type owns its own operation slot: uploads of different types
 * run side by side, and a failure only ever touches its own slot. Readiness
 * flags only move from false to true, so a failed re-upload leaves an earlier
 * success in place.
 *
 * <p>
 * State is written on the session scheduler only; readers get immutable
 * snapshots.
 */
@Slf4j
@Service
public class ConfigurationStatusTracker implements ReadinessSource {

    private final BackendGateway gateway;
    private final Scheduler sessionScheduler;
    private final StudioEventPublisher events;

    private final Map<UploadType, Long> latestUpload = new EnumMap<>(UploadType.class);

    private volatile Map<UploadType, OperationView> operations;

    private volatile ReadinessStatus readiness = ReadinessStatus.initial();

    public ConfigurationStatusTracker(BackendGateway gateway, Scheduler sessionScheduler,
            StudioEventPublisher events) {
        this.gateway = gateway;
        this.sessionScheduler = sessionScheduler;
        this.events = events;

        Map<UploadType, OperationView> initial = new EnumMap<>(UploadType.class);
        for (UploadType type : UploadType.values()) {
            initial.put(type, OperationView.idle(type.getKey()));
            latestUpload.put(type, 0L);
        }
        this.operations = initial;
    }

    @Override
    public ReadinessStatus readiness() {
        return readiness;
    }

    public OperationView operation(UploadType type) {
        return operations.get(type);
    }

    public ConfigurationOverview overview() {
        Map<String, OperationView> uploads = new LinkedHashMap<>();
        operations.forEach((type, view) -> uploads.put(type.getKey(), view));
        return new ConfigurationOverview(uploads, readiness);
    }

    /**
     * Uploads one dataset file. Completes with that upload's view once it
     * settled; never errors.
     */
    public Mono<OperationView> upload(UploadType type, String fileName, byte[] content) {
        return Mono.defer(() -> {
            long ticket = latestUpload.merge(type, 1L, Long::sum);

            String problem = checkFile(type, fileName, content);
            if (problem != null) {
                log.info("{} upload rejected locally: {}", type.getKey(), problem);
                return Mono.just(settle(type, ticket, operation(type).failed(problem)));
            }

            update(type, operation(type).inFlight());
            log.info("Uploading {} '{}' ({} bytes)", type.getKey(), fileName, content.length);

            return gateway.postFile(type.getEndpoint(), fileName, content)
                    .publishOn(sessionScheduler)
                    .map(response -> onUploaded(type, ticket, response))
                    .onErrorResume(error -> Mono.just(onUploadFailed(type, ticket, error)));
        }).subscribeOn(sessionScheduler);
    }

    /**
     * Seeds readiness from the service's own counters at startup. Only ever
     * raises flags. Call on the session scheduler.
     */
    public void applyHealth(HealthStatus health) {
        if (health == null) {
            return;
        }
        ReadinessStatus current = readiness;
        setReadiness(current
                .withCourses(current.isCourses() || health.getCoursesLoaded() > 0)
                .withHolidays(current.isHolidays() || health.getStatesWithHolidays() > 0)
                .withGuidelines(current.isGuidelines() || health.isGuidelinesLoaded()));
    }

    /** Call on the session scheduler. */
    public void updateDocumentCount(int documentCount) {
        setReadiness(readiness.withDocumentCount(documentCount));
    }

    // ── Settlement (session scheduler) ───────────────────────────────────────

    private OperationView onUploaded(UploadType type, long ticket, BackendResponse response) {
        if (response.isArtifact()) {
            return onUploadFailed(type, ticket,
                    new BackendRequestException(BackendRequestException.DECODE_FAILURE_MESSAGE,
                            response.getStatusCode()));
        }
        markReady(type);
        String message = type.successMessage(response.getPayload());
        log.info("{} upload succeeded: {}", type.getKey(), message);
        return settle(type, ticket, operation(type).succeeded(message, response.getPayload()));
    }

    private OperationView onUploadFailed(UploadType type, long ticket, Throwable error) {
        String message = error.getMessage() != null && !error.getMessage().isBlank()
                ? error.getMessage()
                : "Upload failed. Please try again.";
        log.warn("{} upload failed: {}", type.getKey(), message);
        return settle(type, ticket, operation(type).failed(message));
    }

    private OperationView settle(UploadType type, long ticket, OperationView view) {
        if (latestUpload.get(type) != ticket) {
            log.debug("Ignoring superseded {} upload #{}", type.getKey(), ticket);
            return view;
        }
        update(type, view);
        return view;
    }

    private void markReady(UploadType type) {
        ReadinessStatus current = readiness;
        switch (type) {
            case COURSES -> setReadiness(current.withCourses(true));
            case HOLIDAYS -> setReadiness(current.withHolidays(true));
            case GUIDELINES -> setReadiness(current.withGuidelines(true));
        }
    }

    private String checkFile(UploadType type, String fileName, byte[] content) {
        if (content == null || content.length == 0) {
            return "The selected file is empty. Please choose a valid " + type.getExtension() + " file.";
        }
        if (!type.accepts(fileName)) {
            return type.getLabel() + " must be a " + type.getExtension() + " file. Received: " + fileName;
        }
        return null;
    }

    private void update(UploadType type, OperationView view) {
        Map<UploadType, OperationView> next = new EnumMap<>(operations);
        next.put(type, view);
        operations = next;
        events.configurationChanged(overview());
    }

    private void setReadiness(ReadinessStatus next) {
        readiness = next;
        events.configurationChanged(overview());
    }
}
