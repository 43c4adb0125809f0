package com.ai.trainingstudio.exception;

import lombok.Getter;

/**
 * Raised when a call to the generation service does not produce a usable
 * answer: a non-success status, an unreachable host, or a body that cannot be
 * read.
 *
 * {@code statusCode} is null when the failure happened before any HTTP status
 * was received.
 */
@Getter
public class BackendRequestException extends RuntimeException {

    public static final String DECODE_FAILURE_MESSAGE =
            "The generation service returned a response that could not be read.";

    private final Integer statusCode;

    public BackendRequestException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public BackendRequestException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public static BackendRequestException undecodable(int statusCode, Throwable cause) {
        return new BackendRequestException(DECODE_FAILURE_MESSAGE, statusCode, cause);
    }
}
