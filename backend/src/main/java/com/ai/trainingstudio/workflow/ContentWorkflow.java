package com.ai.trainingstudio.workflow;

import com.ai.trainingstudio.client.BackendGateway;
import com.ai.trainingstudio.download.DownloadTrigger;
import com.ai.trainingstudio.dto.ContentForm;
import com.ai.trainingstudio.dto.OutputFormat;
import com.ai.trainingstudio.dto.PersonalizationDefaults;
import com.ai.trainingstudio.exception.WorkflowValidationException;
import com.ai.trainingstudio.service.StudioEventPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

@Component
public class ContentWorkflow extends GenerationWorkflow<ContentForm> {

    public static final String FEATURE = "content";

    public ContentWorkflow(BackendGateway gateway, DownloadTrigger downloadTrigger,
            PersonalizationSource personalization, Scheduler sessionScheduler,
            StudioEventPublisher events, ObjectMapper objectMapper) {
        super(FEATURE, "/create/content", gateway, downloadTrigger, personalization,
                sessionScheduler, events, objectMapper);
    }

    @Override
    protected void validate(ContentForm form) {
        if (isBlank(form.getTopic())) {
            throw new WorkflowValidationException("Please describe the content you need.");
        }
        if (normalizeDocuments(form.getSelectedDocuments()).isEmpty()) {
            throw new WorkflowValidationException(
                    "Select at least one knowledge base document to ground the content.");
        }
    }

    @Override
    protected ObjectNode buildRequest(ContentForm form, PersonalizationDefaults defaults) {
        ObjectNode body = baseRequest(form.getTopic(),
                orDefault(form.getLanguage(), defaults.getSuggestedLanguage()),
                requestedFormat(form), form.getSelectedDocuments());
        body.put("content_type", orDefault(form.getContentType(), ContentForm.CONTENT_TYPES.get(0)));
        body.put("audience", orDefault(form.getAudience(), ContentForm.DEFAULT_AUDIENCE));
        body.put("tone", orDefault(form.getTone(), ContentForm.TONES.get(0)));
        body.put("length", orDefault(form.getLength(), ContentForm.LENGTHS.get(1)));
        body.put("include_practice", form.isIncludePractice());
        return body;
    }

    @Override
    protected OutputFormat requestedFormat(ContentForm form) {
        return form.getFormat() != null ? form.getFormat() : OutputFormat.INTERACTIVE;
    }

    @Override
    protected String genericFailureMessage() {
        return "Failed to generate learning content.";
    }
}
