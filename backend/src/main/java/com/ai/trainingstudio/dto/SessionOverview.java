package com.ai.trainingstudio.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the UI needs to draw its header and selectors.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionOverview {

    public static final List<String> LANGUAGES = List.of(
            "English", "Bengali", "Hindi", "Marathi", "Tamil", "Telugu", "Gujarati", "Kannada");

    boolean loading;

    String error;

    List<String> documents;

    ReadinessStatus readiness;

    HealthStatus health;

    LocationSuggestion location;

    String locationDescription;

    PersonalizationDefaults defaults;

    List<String> languages;
}
