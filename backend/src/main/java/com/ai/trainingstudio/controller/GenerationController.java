package com.ai.trainingstudio.controller;

import com.ai.trainingstudio.dto.AssessmentForm;
import com.ai.trainingstudio.dto.ContentForm;
import com.ai.trainingstudio.dto.LessonPlanForm;
import com.ai.trainingstudio.workflow.AssessmentWorkflow;
import com.ai.trainingstudio.workflow.ContentWorkflow;
import com.ai.trainingstudio.workflow.GenerationWorkflow;
import com.ai.trainingstudio.workflow.LessonPlanWorkflow;
import com.ai.trainingstudio.workflow.ViewMode;
import com.ai.trainingstudio.workflow.WorkflowSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Map;

/**
 * GenerationController exposes the three generation workflows.
 *
 * <p>
 * A POST completes once the submission settled and returns the workflow's
 * snapshot: RENDERED with the result, DOWNLOADED with the saved file name, or
 * FAILED with the message to show. Local validation failures come back the
 * same way (state FAILED, HTTP 200), they are not request errors.
 */
@Slf4j
@RestController
@RequestMapping("/api/generate")
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class GenerationController {

    private final AssessmentWorkflow assessmentWorkflow;
    private final LessonPlanWorkflow lessonPlanWorkflow;
    private final ContentWorkflow contentWorkflow;
    private final Map<String, GenerationWorkflow<?>> workflows;

    public GenerationController(AssessmentWorkflow assessmentWorkflow, LessonPlanWorkflow lessonPlanWorkflow,
            ContentWorkflow contentWorkflow) {
        this.assessmentWorkflow = assessmentWorkflow;
        this.lessonPlanWorkflow = lessonPlanWorkflow;
        this.contentWorkflow = contentWorkflow;
        this.workflows = Map.of(
                AssessmentWorkflow.FEATURE, assessmentWorkflow,
                LessonPlanWorkflow.FEATURE, lessonPlanWorkflow,
                ContentWorkflow.FEATURE, contentWorkflow);
    }

    // ── POST /api/generate/{feature} ─────────────────────────────────────────

    @PostMapping("/" + AssessmentWorkflow.FEATURE)
    public Mono<WorkflowSnapshot> createAssessment(@RequestBody AssessmentForm form) {
        log.info("Assessment requested: format={}, documents={}", form.getFormat(), form.getSelectedDocuments());
        return assessmentWorkflow.submit(form);
    }

    @PostMapping("/" + LessonPlanWorkflow.FEATURE)
    public Mono<WorkflowSnapshot> createLessonPlan(@RequestBody LessonPlanForm form) {
        log.info("Lesson plan requested: format={}, region={}, documents={}",
                form.getFormat(), form.getRegion(), form.getSelectedDocuments());
        return lessonPlanWorkflow.submit(form);
    }

    @PostMapping("/" + ContentWorkflow.FEATURE)
    public Mono<WorkflowSnapshot> createContent(@RequestBody ContentForm form) {
        log.info("Content requested: type={}, format={}, documents={}",
                form.getContentType(), form.getFormat(), form.getSelectedDocuments());
        return contentWorkflow.submit(form);
    }

    // ── GET /api/generate/{feature} ──────────────────────────────────────────

    @GetMapping("/{feature}")
    public WorkflowSnapshot snapshot(@PathVariable String feature) {
        return workflow(feature).getSnapshot();
    }

    // ── PUT /api/generate/{feature}/view?mode=preview|raw ────────────────────

    @PutMapping("/{feature}/view")
    public Mono<WorkflowSnapshot> changeView(@PathVariable String feature, @RequestParam String mode) {
        ViewMode viewMode;
        try {
            viewMode = ViewMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid view mode. Use: preview or raw.");
        }
        return workflow(feature).changeView(viewMode);
    }

    // ── DELETE /api/generate/{feature} ───────────────────────────────────────

    @DeleteMapping("/{feature}")
    public Mono<WorkflowSnapshot> reset(@PathVariable String feature) {
        return workflow(feature).reset();
    }

    private GenerationWorkflow<?> workflow(String feature) {
        GenerationWorkflow<?> workflow = workflows.get(feature.toLowerCase(Locale.ROOT));
        if (workflow == null) {
            throw new IllegalArgumentException(
                    "Unknown feature '" + feature + "'. Use: assessment, lesson-plan or content.");
        }
        return workflow;
    }
}
