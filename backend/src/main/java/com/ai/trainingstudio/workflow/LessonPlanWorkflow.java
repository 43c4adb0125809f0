package com.ai.trainingstudio.workflow;

import com.ai.trainingstudio.client.BackendGateway;
import com.ai.trainingstudio.download.DownloadTrigger;
import com.ai.trainingstudio.dto.LessonPlanForm;
import com.ai.trainingstudio.dto.OutputFormat;
import com.ai.trainingstudio.dto.PersonalizationDefaults;
import com.ai.trainingstudio.dto.ReadinessStatus;
import com.ai.trainingstudio.exception.WorkflowValidationException;
import com.ai.trainingstudio.service.StudioEventPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.List;

/**
 * Lesson planner. Schedules sessions around the regional holiday calendar
 * and the course duration data when the service has them.
 */
@Component
public class LessonPlanWorkflow extends GenerationWorkflow<LessonPlanForm> {

    public static final String FEATURE = "lesson-plan";

    private final ReadinessSource readinessSource;

    public LessonPlanWorkflow(BackendGateway gateway, DownloadTrigger downloadTrigger,
            PersonalizationSource personalization, ReadinessSource readinessSource,
            Scheduler sessionScheduler, StudioEventPublisher events, ObjectMapper objectMapper) {
        super(FEATURE, "/create/lesson_plan", gateway, downloadTrigger, personalization,
                sessionScheduler, events, objectMapper);
        this.readinessSource = readinessSource;
    }

    @Override
    protected void validate(LessonPlanForm form) {
        if (isBlank(form.getTopic())) {
            throw new WorkflowValidationException("Please describe the lesson plan focus area.");
        }
        if (normalizeDocuments(form.getSelectedDocuments()).isEmpty()) {
            throw new WorkflowValidationException("Select at least one document to ground the lesson plan.");
        }
    }

    @Override
    protected ObjectNode buildRequest(LessonPlanForm form, PersonalizationDefaults defaults) {
        ObjectNode body = baseRequest(form.getTopic(),
                orDefault(form.getLanguage(), defaults.getSuggestedLanguage()),
                requestedFormat(form), form.getSelectedDocuments());
        body.put("course_name", form.getCourseName() == null ? "" : form.getCourseName().trim());
        body.put("state", orDefault(form.getRegion(), defaults.getSuggestedRegion()));
        body.put("start_date", form.getStartDate() == null ? "" : form.getStartDate().trim());
        return body;
    }

    @Override
    protected OutputFormat requestedFormat(LessonPlanForm form) {
        return form.getFormat() != null ? form.getFormat() : OutputFormat.INTERACTIVE;
    }

    @Override
    protected List<String> advisories(LessonPlanForm form) {
        ReadinessStatus readiness = readinessSource.readiness();
        List<String> advisories = new ArrayList<>();
        if (!readiness.isCourses()) {
            advisories.add("Course duration data has not been uploaded; session counts are estimated.");
        }
        if (!readiness.isHolidays()) {
            advisories.add("Holiday calendar has not been uploaded; regional holidays are not avoided.");
        }
        return advisories;
    }

    @Override
    protected String genericFailureMessage() {
        return "Failed to generate lesson plan.";
    }
}
