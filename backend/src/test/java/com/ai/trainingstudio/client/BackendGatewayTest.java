package com.ai.trainingstudio.client;

import com.ai.trainingstudio.dto.DocumentsResponse;
import com.ai.trainingstudio.exception.BackendRequestException;
import com.ai.trainingstudio.support.StubBackend;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(OutputCaptureExtension.class)
class BackendGatewayTest {

    private final StubBackend backend = new StubBackend();
    private final BackendGateway gateway = backend.gateway();

    @Test
    void should_ReturnStructured_When_ContentTypeIsJson() {
        backend.onJson("/create/assessment", "{\"english_answer\":\"Q1\",\"sources\":[\"guide.pdf\"]}");

        BackendResponse response = gateway.postJson("/create/assessment", Map.of("query", "x")).block();

        assertEquals(BackendResponse.Kind.STRUCTURED, response.getKind());
        assertEquals("Q1", response.getPayload().path("english_answer").asText());
        assertNull(response.getContent());
        assertEquals(1, backend.requestsTo("/create/assessment"));
        assertEquals(HttpMethod.POST, backend.requests().get(0).method());
    }

    @Test
    void should_ReturnArtifact_When_ContentTypeIsNotJson() {
        byte[] pdf = "%PDF-1.4 body".getBytes(StandardCharsets.US_ASCII);
        backend.on("/create/lesson_plan", () -> Mono.just(StubBackend.file(
                pdf, "application/pdf", "attachment; filename=lesson_plan_greetings.pdf")));

        BackendResponse response = gateway.postJson("/create/lesson_plan", Map.of()).block();

        assertTrue(response.isArtifact());
        assertArrayEquals(pdf, response.getContent());
        assertEquals("application/pdf", response.getMimeType());
        assertEquals("attachment; filename=lesson_plan_greetings.pdf", response.getContentDisposition());
        assertNull(response.getPayload());
    }

    @Test
    void should_ClassifyByResponse_When_JsonComesBackWithCharset() {
        backend.on("/health", () -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header("Content-Type", "application/json; charset=utf-8")
                .body("{\"status\":\"healthy\"}")
                .build()));

        assertEquals(BackendResponse.Kind.STRUCTURED, gateway.get("/health").block().getKind());
    }

    @Test
    void should_UseJsonErrorField_When_FailureBodyIsJson() {
        backend.on("/create/content", () -> Mono.just(
                StubBackend.json(HttpStatus.BAD_REQUEST, "{\"error\":\"Topic is required\"}")));

        BackendRequestException error = assertThrows(BackendRequestException.class,
                () -> gateway.postJson("/create/content", Map.of()).block());

        assertEquals("Topic is required", error.getMessage());
        assertEquals(400, error.getStatusCode());
    }

    @Test
    void should_UseRawText_When_FailureBodyIsNotJson() {
        backend.on("/upload/holidays", () -> Mono.just(
                StubBackend.text(HttpStatus.INTERNAL_SERVER_ERROR, "holiday sheet has no State column")));

        BackendRequestException error = assertThrows(BackendRequestException.class,
                () -> gateway.postFile("/upload/holidays", "holidays.csv", new byte[] { 1 }).block());

        assertEquals("holiday sheet has no State column", error.getMessage());
        assertEquals(500, error.getStatusCode());
    }

    @Test
    void should_UseStatusText_When_FailureBodyIsEmpty() {
        backend.on("/get_documents", () -> Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build()));

        BackendRequestException error = assertThrows(BackendRequestException.class,
                () -> gateway.get("/get_documents").block());

        assertEquals("Service Unavailable", error.getMessage());
        assertEquals(503, error.getStatusCode());
    }

    @Test
    void should_UseStatusText_When_JsonFailureHasNoErrorField() {
        backend.on("/create/assessment", () -> Mono.just(
                StubBackend.json(HttpStatus.UNPROCESSABLE_ENTITY, "{\"success\":false}")));

        BackendRequestException error = assertThrows(BackendRequestException.class,
                () -> gateway.postJson("/create/assessment", Map.of()).block());

        assertEquals("Unprocessable Entity", error.getMessage());
    }

    @Test
    void should_ReportGenericMessage_When_JsonBodyIsCorrupt() {
        backend.onJson("/create/assessment", "{\"english_answer\": ");

        BackendRequestException error = assertThrows(BackendRequestException.class,
                () -> gateway.postJson("/create/assessment", Map.of()).block());

        assertEquals(BackendRequestException.DECODE_FAILURE_MESSAGE, error.getMessage());
        assertEquals(200, error.getStatusCode());
    }

    @Test
    void should_ReportGenericMessage_When_FileBodyIsEmpty() {
        backend.on("/create/assessment", () -> Mono.just(
                StubBackend.file(new byte[0], "application/pdf", null)));

        BackendRequestException error = assertThrows(BackendRequestException.class,
                () -> gateway.postJson("/create/assessment", Map.of()).block());

        assertEquals(BackendRequestException.DECODE_FAILURE_MESSAGE, error.getMessage());
    }

    @Test
    void should_FailWithoutStatus_When_ServiceIsUnreachable() {
        backend.on("/health", () -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), HttpMethod.GET,
                URI.create("http://studio-backend.test/health"), new org.springframework.http.HttpHeaders())));

        BackendRequestException error = assertThrows(BackendRequestException.class,
                () -> gateway.get("/health").block());

        assertNull(error.getStatusCode());
        assertTrue(error.getMessage().startsWith("Unable to reach the generation service"));
    }

    @Test
    void should_SendMultipartForm_When_UploadingFile() {
        backend.onJson("/upload/guidelines", "{\"success\":true,\"guidelines_length\":42}");

        gateway.postFile("/upload/guidelines", "guidelines.txt", "be kind".getBytes(StandardCharsets.UTF_8))
                .block();

        MediaType sent = backend.requests().get(0).headers().getContentType();
        assertTrue(MediaType.MULTIPART_FORM_DATA.isCompatibleWith(sent), String.valueOf(sent));
    }

    @Test
    void should_BindStructuredPayload_When_ReadingTypedAnswer() {
        backend.onJson("/get_documents", "{\"documents\":[\"guide.pdf\",\"faq.pdf\"],\"total_count\":2}");

        DocumentsResponse documents = gateway.getStructured("/get_documents", DocumentsResponse.class).block();

        assertEquals(List.of("guide.pdf", "faq.pdf"), documents.getDocuments());
        assertEquals(2, documents.getTotalCount());
    }

    @Test
    void should_RejectFileAnswer_When_StructuredAnswerWasExpected() {
        backend.on("/get_documents", () -> Mono.just(
                StubBackend.file(new byte[] { 1, 2 }, "application/octet-stream", null)));

        assertThrows(BackendRequestException.class,
                () -> gateway.getStructured("/get_documents", DocumentsResponse.class).block());
    }

    @Test
    void should_TreatProblemJsonAsStructured() {
        assertTrue(BackendGateway.isStructured(MediaType.APPLICATION_PROBLEM_JSON));
        assertTrue(BackendGateway.isStructured(MediaType.APPLICATION_JSON));
        assertTrue(!BackendGateway.isStructured(MediaType.APPLICATION_PDF));
        assertTrue(!BackendGateway.isStructured(null));
    }

    @Test
    void should_StartCallOnlyOnSubscription(CapturedOutput output) {
        backend.onJson("/health", "{\"status\":\"healthy\"}");

        Mono<BackendResponse> call = gateway.get("/health");

        assertFalse(output.getOut().contains("Calling generation service: GET /health"));
        assertEquals(0, backend.requests().size());

        call.block();

        assertTrue(output.getOut().contains("Calling generation service: GET /health"));
        assertEquals(1, backend.requestsTo("/health"));
    }
}
