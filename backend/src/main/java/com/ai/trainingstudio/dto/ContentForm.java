package com.ai.trainingstudio.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Content generator form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentForm {

    public static final String DEFAULT_TOPIC =
            "Create a learner handout on effective body language for front desk associates.";
    public static final String DEFAULT_AUDIENCE = "Front Desk Associate trainees";

    public static final List<String> CONTENT_TYPES = List.of(
            "Learning Guide", "Facilitator Notes", "Workshop Outline", "Learner Handout", "Quick Reference Sheet");
    public static final List<String> TONES = List.of(
            "Professional", "Friendly", "Motivational", "Coaching", "Inspirational");
    public static final List<String> LENGTHS = List.of("Brief", "Standard", "In-depth");

    @Builder.Default
    private String topic = DEFAULT_TOPIC;

    @Builder.Default
    private String contentType = CONTENT_TYPES.get(0);

    @Builder.Default
    private String tone = TONES.get(0);

    @Builder.Default
    private String audience = DEFAULT_AUDIENCE;

    @Builder.Default
    private String length = LENGTHS.get(1);

    @Builder.Default
    private boolean includePractice = true;

    private String language;

    @Builder.Default
    private OutputFormat format = OutputFormat.INTERACTIVE;

    @Builder.Default
    private List<String> selectedDocuments = new ArrayList<>();
}
