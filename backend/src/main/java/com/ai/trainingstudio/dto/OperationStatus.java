package com.ai.trainingstudio.dto;

/**
 * Lifecycle of one asynchronous user action (an upload, a batch run).
 */
public enum OperationStatus {
    IDLE,
    IN_FLIGHT,
    SUCCEEDED,
    FAILED
}
