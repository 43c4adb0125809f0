package com.ai.trainingstudio.workflow;

import com.ai.trainingstudio.dto.GenerationResult;
import com.ai.trainingstudio.dto.OutputFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable view of one generation workflow.
 *
 * <pre>
 * ┌────────────┬─────────────────────────────────────────────┐
 * │ state      │ populated fields                            │
 * ├────────────┼─────────────────────────────────────────────┤
 * │ RENDERED   │ result, payload, viewMode, presentation     │
 * │ DOWNLOADED │ downloadedFileName, savedTo                 │
 * │ FAILED     │ error                                       │
 * └────────────┴─────────────────────────────────────────────┘
 * </pre>
 *
 * Results of one state never leak into another: a failure clears the last
 * result, a download clears the last rendered payload.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowSnapshot {

    String feature;

    WorkflowState state;

    /** Submission this snapshot belongs to; 0 before the first one. */
    long sequence;

    OutputFormat requestedFormat;

    GenerationResult result;

    JsonNode payload;

    ViewMode viewMode;

    String presentation;

    String downloadedFileName;

    String savedTo;

    String error;

    @Singular
    List<String> advisories;

    public static WorkflowSnapshot idle(String feature) {
        return WorkflowSnapshot.builder()
                .feature(feature)
                .state(WorkflowState.IDLE)
                .viewMode(ViewMode.PREVIEW)
                .build();
    }

    /** Fresh snapshot for a new submission; nothing from the previous cycle survives. */
    public static WorkflowSnapshot validating(String feature, long sequence) {
        return WorkflowSnapshot.builder()
                .feature(feature)
                .state(WorkflowState.VALIDATING)
                .sequence(sequence)
                .viewMode(ViewMode.PREVIEW)
                .build();
    }
}
