package com.ai.trainingstudio.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * The three auxiliary datasets the generation service accepts.
 */
public enum UploadType {

    COURSES("courses", "Course duration data", "/upload/course_data", ".csv") {
        @Override
        public String successMessage(JsonNode summary) {
            return "Loaded " + count(summary, "the uploaded", "courses_loaded", "records_loaded") + " courses.";
        }
    },

    HOLIDAYS("holidays", "Holiday calendar", "/upload/holidays", ".csv") {
        @Override
        public String successMessage(JsonNode summary) {
            return "Loaded holiday data for "
                    + count(summary, "the uploaded", "states_loaded", "regions_loaded") + " regions.";
        }
    },

    GUIDELINES("guidelines", "Assessment guidelines", "/upload/guidelines", ".txt") {
        @Override
        public String successMessage(JsonNode summary) {
            return "Guidelines imported (" + count(summary, "unknown", "guidelines_length") + " characters).";
        }
    };

    private final String key;
    private final String label;
    private final String endpoint;
    private final String extension;

    UploadType(String key, String label, String endpoint, String extension) {
        this.key = key;
        this.label = label;
        this.endpoint = endpoint;
        this.extension = extension;
    }

    public abstract String successMessage(JsonNode summary);

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getExtension() {
        return extension;
    }

    public boolean accepts(String fileName) {
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(extension);
    }

    public static UploadType fromKey(String key) {
        for (UploadType type : values()) {
            if (type.key.equalsIgnoreCase(key) || type.name().equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown upload type: " + key);
    }

    /** First non-zero, non-empty field among {@code fields}, else {@code fallback}. */
    private static String count(JsonNode summary, String fallback, String... fields) {
        if (summary != null) {
            for (String field : fields) {
                JsonNode value = summary.path(field);
                if (value.isMissingNode() || value.isNull()) {
                    continue;
                }
                String text = value.asText("");
                if (!text.isEmpty() && !(value.isNumber() && value.asDouble() == 0)) {
                    return text;
                }
            }
        }
        return fallback;
    }
}
