package com.ai.trainingstudio.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Output format requested from the generation service. This is only a
 * request: the service decides what it actually returns.
 */
public enum OutputFormat {

    INTERACTIVE("json"),
    WORD_DOCUMENT("docx"),
    PDF_DOCUMENT("pdf");

    private final String wireValue;

    OutputFormat(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Accepts the wire value ({@code json}, {@code docx}, {@code pdf}), the
     * constant name, or its dashed form ({@code word-document}).
     */
    @JsonCreator
    public static OutputFormat from(String value) {
        if (value == null || value.isBlank()) {
            return INTERACTIVE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (OutputFormat format : values()) {
            if (format.wireValue.equals(normalized)
                    || format.name().toLowerCase(Locale.ROOT).replace('_', '-').equals(normalized.replace('_', '-'))) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported output format: " + value);
    }
}
