package com.ai.trainingstudio.dto;

import lombok.Value;

/**
 * Read-only projection of the location suggestion handed to the generation
 * workflows.
 */
@Value
public class PersonalizationDefaults {

    public static final String DEFAULT_LANGUAGE = "English";
    public static final String DEFAULT_REGION = "Corporate";

    public static final PersonalizationDefaults FALLBACK =
            new PersonalizationDefaults(DEFAULT_LANGUAGE, DEFAULT_REGION);

    String suggestedLanguage;

    String suggestedRegion;

    public static PersonalizationDefaults from(LocationSuggestion suggestion) {
        if (suggestion == null) {
            return FALLBACK;
        }
        String language = suggestion.getSuggestedLanguage();
        String region = suggestion.getRegion();
        return new PersonalizationDefaults(
                language != null && !language.isBlank() ? language : DEFAULT_LANGUAGE,
                region != null && !region.isBlank() ? region : DEFAULT_REGION);
    }
}
