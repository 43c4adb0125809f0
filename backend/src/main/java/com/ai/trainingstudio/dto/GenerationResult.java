package com.ai.trainingstudio.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Structured answer of the three /create endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerationResult {

    /** Generated text in English (markdown). */
    @JsonProperty("english_answer")
    private String englishAnswer;

    /** Same text translated into the requested language, when one was produced. */
    @JsonProperty("translated_answer")
    private String translatedAnswer;

    private String language;

    /** Knowledge-base documents the answer was grounded on. */
    private List<String> sources;

    /** Lesson plans only: the holidays the schedule avoided. */
    @JsonProperty("holidays_considered")
    private String holidaysConsidered;

    /** Content pieces only: echo of type, tone, audience and so on. */
    private Map<String, Object> metadata;

    /**
     * Text shown to the user: the translation when present, otherwise English.
     */
    public String displayText() {
        if (translatedAnswer != null && !translatedAnswer.isBlank()) {
            return translatedAnswer;
        }
        return englishAnswer != null ? englishAnswer : "";
    }
}
