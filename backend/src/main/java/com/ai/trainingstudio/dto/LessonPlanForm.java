package com.ai.trainingstudio.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Lesson planner form. {@code region} selects the holiday calendar; blank
 * means the session's suggested region. {@code startDate} is an ISO date or
 * empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LessonPlanForm {

    public static final String DEFAULT_TOPIC =
            "A detailed lesson plan for Front Desk Associate trainees focusing on guest engagement.";

    @Builder.Default
    private String topic = DEFAULT_TOPIC;

    private String courseName;

    private String region;

    private String startDate;

    private String language;

    @Builder.Default
    private OutputFormat format = OutputFormat.INTERACTIVE;

    @Builder.Default
    private List<String> selectedDocuments = new ArrayList<>();
}
