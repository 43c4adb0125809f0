package com.ai.trainingstudio.exception;

/**
 * Local validation failure detected before anything is sent to the
 * generation service.
 */
public class WorkflowValidationException extends RuntimeException {

    public WorkflowValidationException(String message) {
        super(message);
    }
}
