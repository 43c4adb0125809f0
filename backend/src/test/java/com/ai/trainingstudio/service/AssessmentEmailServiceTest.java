package com.ai.trainingstudio.service;

import com.ai.trainingstudio.dto.EmailProcessingResult;
import com.ai.trainingstudio.dto.OperationStatus;
import com.ai.trainingstudio.dto.OperationView;
import com.ai.trainingstudio.support.StubBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class AssessmentEmailServiceTest {

    private static final String ENDPOINT = "/process/assessment_and_email";

    private static final byte[] SHEET = "email,Q1,Q2\na@example.com,1,0\n".getBytes(StandardCharsets.UTF_8);

    private StubBackend backend;
    private StudioEventPublisher events;
    private AssessmentEmailService service;

    @BeforeEach
    void setUp() {
        backend = new StubBackend();
        events = mock(StudioEventPublisher.class);
        service = new AssessmentEmailService(backend.gateway(), Schedulers.immediate(), events);
    }

    @Test
    void should_SummarizeEmailRun_When_SheetIsProcessed() {
        backend.onJson(ENDPOINT, "{\"success\":true,\"total_students\":10,\"average_score\":62.46,"
                + "\"emails_sent\":4,\"weak_questions\":[{\"question\":\"Q2\",\"success_rate\":30.0}]}");

        OperationView view = service.process("scores.xlsx", SHEET).block();

        assertEquals(OperationStatus.SUCCEEDED, view.getStatus());
        assertEquals("Emails sent to 4 of 10 students (average score 62.5).", view.getMessage());
        EmailProcessingResult result = assertInstanceOf(EmailProcessingResult.class, view.getResult());
        assertEquals("Q2", result.getWeakQuestions().get(0).getQuestion());
        verify(events, atLeastOnce()).personalizedChanged(any());
    }

    @Test
    void should_RejectLocally_When_FileIsNotASpreadsheet() {
        OperationView view = service.process("scores.pdf", SHEET).block();

        assertEquals(OperationStatus.FAILED, view.getStatus());
        assertEquals("Invalid file format. Upload CSV or Excel", view.getError());
        assertEquals(0, backend.requests().size());
    }

    @Test
    void should_AskForFile_When_NothingWasChosen() {
        OperationView view = service.process("scores.csv", null).block();

        assertEquals("Please choose a CSV or Excel file with assessment data.", view.getError());
    }

    @Test
    void should_ShowServiceError_When_ProcessingFails() {
        backend.on(ENDPOINT, () -> Mono.just(
                StubBackend.json(HttpStatus.BAD_REQUEST, "{\"error\":\"No email column found\"}")));

        OperationView view = service.process("scores.csv", SHEET).block();

        assertEquals(OperationStatus.FAILED, view.getStatus());
        assertEquals("No email column found", view.getError());
        assertEquals(view, service.current());
    }
}
