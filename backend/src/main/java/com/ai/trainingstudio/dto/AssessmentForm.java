package com.ai.trainingstudio.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Assessment creator form. A blank {@code language} falls back to the
 * session's suggested language.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssessmentForm {

    public static final String DEFAULT_TOPIC = "Create a quiz about greeting guests at a hotel.";

    @Builder.Default
    private String topic = DEFAULT_TOPIC;

    private String language;

    @Builder.Default
    private OutputFormat format = OutputFormat.INTERACTIVE;

    @Builder.Default
    private List<String> selectedDocuments = new ArrayList<>();
}
