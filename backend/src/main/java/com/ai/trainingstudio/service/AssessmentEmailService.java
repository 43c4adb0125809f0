package com.ai.trainingstudio.service;

import com.ai.trainingstudio.client.BackendGateway;
import com.ai.trainingstudio.dto.EmailProcessingResult;
import com.ai.trainingstudio.dto.OperationView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Locale;

/**
 * Personalized learning: sends a scored assessment sheet to the service,
 * which emails a study guide to every student below the pass mark.
 */
@Slf4j
@Service
public class AssessmentEmailService {

    public static final String OPERATION = "assessment-email";

    private static final String ENDPOINT = "/process/assessment_and_email";
    private static final List<String> ACCEPTED_EXTENSIONS = List.of(".csv", ".xlsx", ".xls");

    private final BackendGateway gateway;
    private final Scheduler sessionScheduler;
    private final StudioEventPublisher events;

    private long latestRun;

    private volatile OperationView view = OperationView.idle(OPERATION);

    public AssessmentEmailService(BackendGateway gateway, Scheduler sessionScheduler, StudioEventPublisher events) {
        this.gateway = gateway;
        this.sessionScheduler = sessionScheduler;
        this.events = events;
    }

    public OperationView current() {
        return view;
    }

    public Mono<OperationView> process(String fileName, byte[] content) {
        return Mono.defer(() -> {
            long run = ++latestRun;
            if (content == null || content.length == 0) {
                return Mono.just(settle(run, view.failed("Please choose a CSV or Excel file with assessment data.")));
            }
            if (!hasAcceptedExtension(fileName)) {
                return Mono.just(settle(run, view.failed("Invalid file format. Upload CSV or Excel")));
            }

            update(view.inFlight());
            log.info("Processing assessment sheet '{}' ({} bytes)", fileName, content.length);

            return gateway.postFile(ENDPOINT, fileName, content)
                    .map(response -> gateway.readPayload(response, EmailProcessingResult.class))
                    .publishOn(sessionScheduler)
                    .map(result -> settle(run, view.succeeded(describe(result), result)))
                    .onErrorResume(failure -> {
                        String message = failure.getMessage() != null && !failure.getMessage().isBlank()
                                ? failure.getMessage()
                                : "Failed to process assessment data.";
                        log.warn("Assessment sheet processing failed: {}", message);
                        return Mono.just(settle(run, view.failed(message)));
                    });
        }).subscribeOn(sessionScheduler);
    }

    private OperationView settle(long run, OperationView next) {
        if (run == latestRun) {
            update(next);
        }
        return next;
    }

    private void update(OperationView next) {
        view = next;
        events.personalizedChanged(next);
    }

    private static boolean hasAcceptedExtension(String fileName) {
        if (fileName == null) {
            return false;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        return ACCEPTED_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    private static String describe(EmailProcessingResult result) {
        return String.format(Locale.ROOT, "Emails sent to %d of %d students (average score %.1f).",
                result.getEmailsSent(), result.getTotalStudents(), result.getAverageScore());
    }
}
