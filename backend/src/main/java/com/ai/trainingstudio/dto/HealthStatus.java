package com.ai.trainingstudio.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dataset counters reported by {@code GET /health}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthStatus {

    private String status;

    private String service;

    @JsonProperty("courses_loaded")
    private int coursesLoaded;

    @JsonProperty("states_with_holidays")
    private int statesWithHolidays;

    @JsonProperty("guidelines_loaded")
    private boolean guidelinesLoaded;
}
