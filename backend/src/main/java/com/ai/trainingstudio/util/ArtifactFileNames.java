package com.ai.trainingstudio.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a Content-Disposition header into the name a generated file is saved
 * under.
 *
 * <p>
 * Never throws. A missing or unusable header yields
 * {@code download-<epoch millis>}. Whatever comes out is a bare file name:
 * directory parts are dropped so the name cannot escape the downloads folder.
 */
@Slf4j
public final class ArtifactFileNames {

    public static final String FALLBACK_PREFIX = "download-";

    private static final Pattern FILENAME_PARAM = Pattern.compile("filename\\*?=([^;]+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern EXTENDED_VALUE = Pattern.compile("^[A-Za-z0-9_-]+'[^']*'(.*)$");

    private ArtifactFileNames() {
    }

    public static String resolve(String contentDisposition) {
        String name = sanitize(fromSpring(contentDisposition));
        if (name == null) {
            name = sanitize(lenient(contentDisposition));
        }
        return name != null ? name : fallback();
    }

    public static String fallback() {
        return FALLBACK_PREFIX + System.currentTimeMillis();
    }

    private static String fromSpring(String header) {
        if (!StringUtils.hasText(header)) {
            return null;
        }
        try {
            return ContentDisposition.parse(header).getFilename();
        } catch (RuntimeException e) {
            log.debug("Content-Disposition '{}' is not RFC 6266 compliant: {}", header, e.getMessage());
            return null;
        }
    }

    /**
     * Accepts headers Spring rejects, e.g. a bare {@code filename=...} or an
     * extended value in a charset other than UTF-8/ISO-8859-1.
     */
    private static String lenient(String header) {
        if (!StringUtils.hasText(header)) {
            return null;
        }
        Matcher matcher = FILENAME_PARAM.matcher(header);
        if (!matcher.find()) {
            return null;
        }
        String value = unquote(matcher.group(1).trim());
        Matcher extended = EXTENDED_VALUE.matcher(value);
        if (extended.matches()) {
            try {
                value = UriUtils.decode(extended.group(1), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                log.debug("Undecodable filename* value '{}': {}", value, e.getMessage());
                return null;
            }
        }
        return value;
    }

    /** Drops one matching pair of surrounding quotes; quotes inside the name stay. */
    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
                return value.substring(1, value.length() - 1).trim();
            }
        }
        return value;
    }

    private static String sanitize(String name) {
        if (name == null) {
            return null;
        }
        String cleaned = unquote(name.trim());
        int separator = Math.max(cleaned.lastIndexOf('/'), cleaned.lastIndexOf('\\'));
        if (separator >= 0) {
            cleaned = cleaned.substring(separator + 1);
        }
        cleaned = cleaned.replaceAll("[\\p{Cntrl}:*?<>|]", "_").trim();
        if (cleaned.isEmpty() || ".".equals(cleaned) || "..".equals(cleaned)) {
            return null;
        }
        return cleaned;
    }
}
