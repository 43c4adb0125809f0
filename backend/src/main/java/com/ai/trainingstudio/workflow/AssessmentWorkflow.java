package com.ai.trainingstudio.workflow;

import com.ai.trainingstudio.client.BackendGateway;
import com.ai.trainingstudio.download.DownloadTrigger;
import com.ai.trainingstudio.dto.AssessmentForm;
import com.ai.trainingstudio.dto.OutputFormat;
import com.ai.trainingstudio.dto.PersonalizationDefaults;
import com.ai.trainingstudio.exception.WorkflowValidationException;
import com.ai.trainingstudio.service.StudioEventPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

/**
 * Assessment creator: quiz questions grounded on the selected documents.
 */
@Component
public class AssessmentWorkflow extends GenerationWorkflow<AssessmentForm> {

    public static final String FEATURE = "assessment";

    public AssessmentWorkflow(BackendGateway gateway, DownloadTrigger downloadTrigger,
            PersonalizationSource personalization, Scheduler sessionScheduler,
            StudioEventPublisher events, ObjectMapper objectMapper) {
        super(FEATURE, "/create/assessment", gateway, downloadTrigger, personalization,
                sessionScheduler, events, objectMapper);
    }

    @Override
    protected void validate(AssessmentForm form) {
        if (isBlank(form.getTopic())) {
            throw new WorkflowValidationException("Please describe the assessment topic.");
        }
        if (normalizeDocuments(form.getSelectedDocuments()).isEmpty()) {
            throw new WorkflowValidationException("Please choose at least one knowledge base document.");
        }
    }

    @Override
    protected ObjectNode buildRequest(AssessmentForm form, PersonalizationDefaults defaults) {
        return baseRequest(form.getTopic(), orDefault(form.getLanguage(), defaults.getSuggestedLanguage()),
                requestedFormat(form), form.getSelectedDocuments());
    }

    @Override
    protected OutputFormat requestedFormat(AssessmentForm form) {
        return form.getFormat() != null ? form.getFormat() : OutputFormat.INTERACTIVE;
    }

    @Override
    protected String genericFailureMessage() {
        return "Failed to generate assessment.";
    }
}
