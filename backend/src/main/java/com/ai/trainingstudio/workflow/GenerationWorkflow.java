package com.ai.trainingstudio.workflow;

import com.ai.trainingstudio.client.BackendGateway;
import com.ai.trainingstudio.client.BackendResponse;
import com.ai.trainingstudio.download.DownloadTrigger;
import com.ai.trainingstudio.dto.GenerationResult;
import com.ai.trainingstudio.dto.OutputFormat;
import com.ai.trainingstudio.dto.PersonalizationDefaults;
import com.ai.trainingstudio.exception.BackendRequestException;
import com.ai.trainingstudio.exception.DownloadFailedException;
import com.ai.trainingstudio.exception.WorkflowValidationException;
import com.ai.trainingstudio.service.StudioEventPublisher;
import com.ai.trainingstudio.util.ArtifactFileNames;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One generation feature (assessment, lesson plan, content piece) as a state
 * machine.
 *
 * <h3>Submission cycle</h3>
 * <ol>
 * <li>VALIDATING: local checks; a failure settles as FAILED without any
 * network call.</li>
 * <li>SUBMITTING: the request is built from the form plus the session's
 * personalization defaults and posted once.</li>
 * <li>The answer's Content-Type decides the outcome: JSON → RENDERED, a file
 * → saved through the {@link DownloadTrigger} → DOWNLOADED.</li>
 * <li>Any failure → FAILED with a single user-facing message.</li>
 * </ol>
 *
 * <h3>Threading and ordering</h3>
 * All state lives on the session scheduler. Each submission takes the next
 * sequence number; an answer whose number is no longer the latest is dropped
 * before it can touch state or trigger a download, whatever order the
 * network settles in.
 *
 * @param <F> the feature's form type
 */
@Slf4j
public abstract class GenerationWorkflow<F> {

    private final String feature;
    private final String endpoint;
    private final BackendGateway gateway;
    private final DownloadTrigger downloadTrigger;
    private final PersonalizationSource personalization;
    private final Scheduler sessionScheduler;
    private final StudioEventPublisher events;
    protected final ObjectMapper objectMapper;

    /** Written on the session scheduler only. */
    private long latestSequence;

    private volatile WorkflowSnapshot snapshot;

    protected GenerationWorkflow(String feature, String endpoint, BackendGateway gateway,
            DownloadTrigger downloadTrigger, PersonalizationSource personalization,
            Scheduler sessionScheduler, StudioEventPublisher events, ObjectMapper objectMapper) {
        this.feature = feature;
        this.endpoint = endpoint;
        this.gateway = gateway;
        this.downloadTrigger = downloadTrigger;
        this.personalization = personalization;
        this.sessionScheduler = sessionScheduler;
        this.events = events;
        this.objectMapper = objectMapper;
        this.snapshot = WorkflowSnapshot.idle(feature);
    }

    // ── Feature hooks ────────────────────────────────────────────────────────

    /**
     * @throws WorkflowValidationException when the form cannot be submitted
     */
    protected abstract void validate(F form);

    protected abstract ObjectNode buildRequest(F form, PersonalizationDefaults defaults);

    protected abstract OutputFormat requestedFormat(F form);

    /** Message used when a failure carries no message of its own. */
    protected abstract String genericFailureMessage();

    /** Non-blocking hints shown next to the result, e.g. a missing dataset. */
    protected List<String> advisories(F form) {
        return List.of();
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public String getFeature() {
        return feature;
    }

    public WorkflowSnapshot getSnapshot() {
        return snapshot;
    }

    /**
     * Runs one submission cycle. Completes with the snapshot that is current
     * once this submission settled; if a newer submission was started in the
     * meantime that is the newer one's snapshot.
     */
    public Mono<WorkflowSnapshot> submit(F form) {
        return Mono.defer(() -> {
            long sequence = ++latestSequence;
            publish(WorkflowSnapshot.validating(feature, sequence));

            ObjectNode request;
            OutputFormat format;
            try {
                if (form == null) {
                    throw new WorkflowValidationException("Nothing to submit.");
                }
                validate(form);
                format = requestedFormat(form);
                request = buildRequest(form, personalization.currentDefaults());
            } catch (WorkflowValidationException e) {
                log.info("{} submission #{} rejected locally: {}", feature, sequence, e.getMessage());
                return Mono.just(onFailure(sequence, e));
            }

            publish(snapshot.toBuilder()
                    .state(WorkflowState.SUBMITTING)
                    .requestedFormat(format)
                    .advisories(advisories(form))
                    .build());
            log.info("{} submission #{} sent to {} (format={})", feature, sequence, endpoint, format);

            return gateway.postJson(endpoint, request)
                    .publishOn(sessionScheduler)
                    .map(response -> onResponse(sequence, format, response))
                    .onErrorResume(error -> Mono.just(onFailure(sequence, error)));
        }).subscribeOn(sessionScheduler);
    }

    /**
     * Switches between the readable rendering and the raw JSON of the
     * current result. Never touches the network.
     */
    public Mono<WorkflowSnapshot> changeView(ViewMode mode) {
        return Mono.fromCallable(() -> {
            WorkflowSnapshot current = snapshot;
            if (current.getViewMode() == mode) {
                return current;
            }
            return publish(current.toBuilder()
                    .viewMode(mode)
                    .presentation(present(current.getResult(), current.getPayload(), mode))
                    .build());
        }).subscribeOn(sessionScheduler);
    }

    /** Back to IDLE; a submission still in flight is ignored when it settles. */
    public Mono<WorkflowSnapshot> reset() {
        return Mono.fromCallable(() -> {
            latestSequence++;
            return publish(WorkflowSnapshot.idle(feature));
        }).subscribeOn(sessionScheduler);
    }

    // ── Settlement (session scheduler) ───────────────────────────────────────

    private WorkflowSnapshot onResponse(long sequence, OutputFormat format, BackendResponse response) {
        if (isStale(sequence)) {
            return snapshot;
        }

        if (response.isArtifact()) {
            String fileName = ArtifactFileNames.resolve(response.getContentDisposition());
            Path savedTo = downloadTrigger.save(fileName, response.getContent(), response.getMimeType());
            log.info("{} submission #{} downloaded as {}", feature, sequence, fileName);
            return publish(snapshot.toBuilder()
                    .state(WorkflowState.DOWNLOADED)
                    .downloadedFileName(fileName)
                    .savedTo(savedTo.toString())
                    .result(null)
                    .payload(null)
                    .presentation(null)
                    .error(null)
                    .build());
        }

        if (format != OutputFormat.INTERACTIVE) {
            log.warn("{} submission #{} asked for {} but the service answered with JSON; rendering it",
                    feature, sequence, format);
        }
        JsonNode payload = response.getPayload();
        GenerationResult result = bindResult(response);
        log.info("{} submission #{} rendered ({} sources)", feature, sequence,
                result.getSources() != null ? result.getSources().size() : 0);
        return publish(snapshot.toBuilder()
                .state(WorkflowState.RENDERED)
                .result(result)
                .payload(payload)
                .viewMode(ViewMode.PREVIEW)
                .presentation(present(result, payload, ViewMode.PREVIEW))
                .downloadedFileName(null)
                .savedTo(null)
                .error(null)
                .build());
    }

    private WorkflowSnapshot onFailure(long sequence, Throwable error) {
        if (isStale(sequence)) {
            return snapshot;
        }
        String message = userMessage(error);
        if (!(error instanceof WorkflowValidationException)) {
            log.warn("{} submission #{} failed: {}", feature, sequence, message);
        }
        return publish(snapshot.toBuilder()
                .state(WorkflowState.FAILED)
                .error(message)
                .result(null)
                .payload(null)
                .presentation(null)
                .downloadedFileName(null)
                .savedTo(null)
                .build());
    }

    private boolean isStale(long sequence) {
        if (sequence != latestSequence) {
            log.warn("Dropping stale {} answer #{} (latest is #{})", feature, sequence, latestSequence);
            return true;
        }
        return false;
    }

    private String userMessage(Throwable error) {
        if (error instanceof WorkflowValidationException
                || error instanceof BackendRequestException
                || error instanceof DownloadFailedException) {
            String message = error.getMessage();
            if (message != null && !message.isBlank()) {
                return message;
            }
        } else {
            log.error("Unexpected {} failure: {}", feature, error.getMessage(), error);
        }
        return genericFailureMessage();
    }

    private WorkflowSnapshot publish(WorkflowSnapshot next) {
        snapshot = next;
        events.workflowChanged(feature, next);
        return next;
    }

    /**
     * The JSON payload is what was rendered; the typed view of it is only
     * filled in when the service answered with an object.
     */
    private GenerationResult bindResult(BackendResponse response) {
        JsonNode payload = response.getPayload();
        if (payload == null || !payload.isObject()) {
            log.warn("{} answer is JSON but not an object ({}); showing it as is", feature,
                    payload == null ? "missing" : payload.getNodeType());
            return new GenerationResult();
        }
        return gateway.readPayload(response, GenerationResult.class);
    }

    private String present(GenerationResult result, JsonNode payload, ViewMode mode) {
        if (result == null || payload == null) {
            return null;
        }
        if (!payload.isObject()) {
            return mode == ViewMode.PREVIEW && payload.isTextual() ? payload.asText() : prettyPrint(payload);
        }
        if (mode == ViewMode.RAW) {
            return prettyPrint(payload);
        }
        StringBuilder text = new StringBuilder(result.displayText());
        List<String> sources = result.getSources();
        if (sources != null && !sources.isEmpty()) {
            text.append("\n\nSources:");
            sources.forEach(source -> text.append("\n- ").append(source));
        }
        return text.toString();
    }

    private String prettyPrint(JsonNode payload) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Could not pretty-print {} payload: {}", feature, e.getMessage());
            return payload.toString();
        }
    }

    // ── Helpers for request builders ─────────────────────────────────────────

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    protected static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value.trim();
    }

    /** Trims, drops blanks and duplicates, keeps the user's order. */
    protected static Set<String> normalizeDocuments(Collection<String> documents) {
        Set<String> normalized = new LinkedHashSet<>();
        if (documents != null) {
            for (String document : documents) {
                if (!isBlank(document)) {
                    normalized.add(document.trim());
                }
            }
        }
        return normalized;
    }

    protected ObjectNode baseRequest(String topic, String language, OutputFormat format,
            Collection<String> documents) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("query", topic == null ? "" : topic.trim());
        body.put("language", language);
        body.put("output_format", format.getWireValue());
        ArrayNode selected = body.putArray("selected_documents");
        normalizeDocuments(documents).forEach(selected::add);
        return body;
    }
}
