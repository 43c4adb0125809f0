package com.ai.trainingstudio.client;

import com.ai.trainingstudio.exception.BackendRequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * The only place that talks HTTP to the generation service.
 *
 * <p>
 * Every call is made exactly once (no retries) and settles as either a
 * {@link BackendResponse} or a {@link BackendRequestException}:
 * <ul>
 * <li>Non-2xx status → failure. The message is the JSON {@code error} field
 * when the body is a JSON object, else the raw body text, else the HTTP
 * reason phrase.</li>
 * <li>2xx with a JSON Content-Type → {@code STRUCTURED}.</li>
 * <li>2xx with anything else → {@code ARTIFACT} carrying the raw bytes and
 * the unparsed Content-Disposition header.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackendGateway {

    private static final String DEFAULT_FAILURE_MESSAGE = "Backend request failed";

    private static final String FILE_PART = "file";

    static final String UNREACHABLE_MESSAGE = "Unable to reach the generation service";

    private final WebClient backendWebClient;
    private final ObjectMapper objectMapper;

    public Mono<BackendResponse> get(String path) {
        return send(path, HttpMethod.GET, null);
    }

    public Mono<BackendResponse> postJson(String path, Object payload) {
        return send(path, HttpMethod.POST, payload);
    }

    /**
     * Sends {@code body} as JSON (or no body at all when null).
     */
    public Mono<BackendResponse> send(String path, HttpMethod method, @Nullable Object body) {
        return exchange(path, method, spec -> body == null
                ? spec
                : spec.contentType(MediaType.APPLICATION_JSON).bodyValue(body));
    }

    /**
     * Uploads a single file as the {@code file} part of a multipart form.
     */
    public Mono<BackendResponse> postFile(String path, String fileName, byte[] content) {
        MultipartBodyBuilder parts = new MultipartBodyBuilder();
        parts.part(FILE_PART, new ByteArrayResource(content)).filename(fileName);
        return exchange(path, HttpMethod.POST, spec -> spec
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(parts.build())));
    }

    /**
     * Calls {@code GET path} and binds the structured answer to {@code type}.
     * A file answer where JSON was expected counts as an unreadable response.
     */
    public <T> Mono<T> getStructured(String path, Class<T> type) {
        return get(path).map(response -> readPayload(response, type));
    }

    public <T> T readPayload(BackendResponse response, Class<T> type) {
        if (response.isArtifact()) {
            throw new BackendRequestException(BackendRequestException.DECODE_FAILURE_MESSAGE,
                    response.getStatusCode());
        }
        try {
            return objectMapper.treeToValue(response.getPayload(), type);
        } catch (JsonProcessingException e) {
            throw BackendRequestException.undecodable(response.getStatusCode(), e);
        }
    }

    // ─────────────────────────────────────────────────────────────────────────────
    // Exchange and classification
    // ─────────────────────────────────────────────────────────────────────────────

    private Mono<BackendResponse> exchange(String path, HttpMethod method,
            Function<WebClient.RequestBodySpec, WebClient.RequestHeadersSpec<?>> bodyWriter) {
        return Mono.defer(() -> {
            log.info("Calling generation service: {} {}", method, path);
            long startTime = System.currentTimeMillis();

            return bodyWriter.apply(backendWebClient.method(method).uri(path))
                    .exchangeToMono(this::classify)
                    .onErrorMap(error -> !(error instanceof BackendRequestException),
                            error -> new BackendRequestException(unreachable(error), null, error))
                    .doOnSuccess(response -> log.info("{} {} settled as {} (status={}, elapsed={}ms)",
                            method, path, response.getKind(), response.getStatusCode(),
                            System.currentTimeMillis() - startTime))
                    .doOnError(error -> log.warn("{} {} failed after {}ms: {}",
                            method, path, System.currentTimeMillis() - startTime, error.getMessage()));
        });
    }

    private Mono<BackendResponse> classify(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        MediaType contentType = response.headers().contentType().orElse(null);
        Mono<byte[]> body = response.bodyToMono(byte[].class).defaultIfEmpty(new byte[0]);

        if (!status.is2xxSuccessful()) {
            return body.flatMap(bytes -> Mono.error(
                    new BackendRequestException(describeFailure(status, bytes), status.value())));
        }

        if (isStructured(contentType)) {
            return body.map(bytes -> BackendResponse.structured(decode(bytes, status.value()), status.value()));
        }

        String disposition = response.headers().asHttpHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION);
        String mimeType = contentType != null
                ? new MediaType(contentType.getType(), contentType.getSubtype()).toString()
                : MediaType.APPLICATION_OCTET_STREAM_VALUE;

        return body.map(bytes -> {
            if (bytes.length == 0) {
                throw new BackendRequestException(BackendRequestException.DECODE_FAILURE_MESSAGE, status.value());
            }
            return BackendResponse.artifact(bytes, mimeType, disposition, status.value());
        });
    }

    private static String unreachable(Throwable error) {
        String detail = error.getMessage();
        return detail == null || detail.isBlank()
                ? UNREACHABLE_MESSAGE
                : UNREACHABLE_MESSAGE + ": " + detail;
    }

    static boolean isStructured(@Nullable MediaType contentType) {
        if (contentType == null) {
            return false;
        }
        return MediaType.APPLICATION_JSON.isCompatibleWith(contentType)
                || contentType.getSubtype().endsWith("+json");
    }

    private JsonNode decode(byte[] body, int statusCode) {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || node.isMissingNode()) {
                throw new BackendRequestException(BackendRequestException.DECODE_FAILURE_MESSAGE, statusCode);
            }
            return node;
        } catch (IOException e) {
            throw BackendRequestException.undecodable(statusCode, e);
        }
    }

    private String describeFailure(HttpStatusCode status, byte[] body) {
        HttpStatus known = HttpStatus.resolve(status.value());
        String statusText = known != null ? known.getReasonPhrase() : DEFAULT_FAILURE_MESSAGE;

        if (body.length == 0) {
            return statusText;
        }

        JsonNode json = parseOrNull(body);
        if (json != null && json.isObject()) {
            String error = json.path("error").asText("");
            return error.isBlank() ? statusText : error;
        }

        String text = new String(body, StandardCharsets.UTF_8).trim();
        return text.isEmpty() ? statusText : text;
    }

    @Nullable
    private JsonNode parseOrNull(byte[] body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException notJson) {
            return null;
        }
    }
}
