package com.ai.trainingstudio.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer of {@code POST /detect_location}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LocationData {

    private Location location;

    @JsonProperty("suggested_language")
    private String suggestedLanguage;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Location {

        private String city;

        /** Indian state; doubles as the holiday-calendar region. */
        private String state;

        private String country;

        private boolean detected;
    }
}
