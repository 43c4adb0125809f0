package com.ai.trainingstudio.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Personalization defaults derived from where the user appears to be.
 */
@Value
@With
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocationSuggestion {

    public enum Provenance {
        UNKNOWN,
        IP,
        BROWSER
    }

    String region;

    String city;

    String country;

    boolean detected;

    /** Language proposed by the service for this location, may be null. */
    String suggestedLanguage;

    Provenance provenance;

    /** The user refused the browser geolocation prompt. */
    boolean permissionDenied;

    public static LocationSuggestion unknown() {
        return LocationSuggestion.builder().provenance(Provenance.UNKNOWN).build();
    }

    public String describe() {
        if (!detected) {
            return "Location not detected. Defaults applied.";
        }
        String suffix = provenance == Provenance.BROWSER ? " (browser)"
                : provenance == Provenance.IP ? " (IP lookup)" : "";
        return "Detected: " + (city != null ? city : "Your city") + ", "
                + (region != null ? region : "India") + suffix;
    }
}
