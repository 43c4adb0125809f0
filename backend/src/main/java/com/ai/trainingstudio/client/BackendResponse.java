package com.ai.trainingstudio.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One successful answer from the generation service.
 *
 * <p>
 * The same endpoint can answer with a rendered JSON result or with a
 * generated Word/PDF file. Which one it is gets decided from the response's
 * Content-Type only, never from the format the caller asked for:
 *
 * <pre>
 * ┌────────────┬───────────────────────────────────────────────┐
 * │ kind       │ populated fields                              │
 * ├────────────┼───────────────────────────────────────────────┤
 * │ STRUCTURED │ payload                                       │
 * │ ARTIFACT   │ content, mimeType, contentDisposition (raw)   │
 * └────────────┴───────────────────────────────────────────────┘
 * </pre>
 */
@Getter
@ToString(exclude = { "payload", "content" })
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BackendResponse {

    public enum Kind {
        STRUCTURED,
        ARTIFACT
    }

    private final Kind kind;

    private final int statusCode;

    /** Decoded JSON body (STRUCTURED only). */
    private final JsonNode payload;

    /** Raw file bytes (ARTIFACT only). */
    private final byte[] content;

    /** Media type of the file without parameters (ARTIFACT only). */
    private final String mimeType;

    /** Unparsed Content-Disposition header, may be null (ARTIFACT only). */
    private final String contentDisposition;

    public static BackendResponse structured(JsonNode payload, int statusCode) {
        return new BackendResponse(Kind.STRUCTURED, statusCode, payload, null, null, null);
    }

    public static BackendResponse artifact(byte[] content, String mimeType, String contentDisposition,
            int statusCode) {
        return new BackendResponse(Kind.ARTIFACT, statusCode, null, content, mimeType, contentDisposition);
    }

    public boolean isArtifact() {
        return kind == Kind.ARTIFACT;
    }
}
