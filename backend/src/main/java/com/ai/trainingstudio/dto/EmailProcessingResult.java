package com.ai.trainingstudio.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Summary returned by {@code POST /process/assessment_and_email}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmailProcessingResult {

    @JsonProperty("total_students")
    private int totalStudents;

    @JsonProperty("average_score")
    private double averageScore;

    @JsonProperty("emails_sent")
    private int emailsSent;

    /** One entry per student: email, status, score, percentage. */
    @JsonProperty("email_results")
    private List<Map<String, Object>> emailResults;

    @JsonProperty("weak_questions")
    private List<WeakQuestion> weakQuestions;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WeakQuestion {

        private String question;

        @JsonProperty("success_rate")
        private double successRate;
    }
}
