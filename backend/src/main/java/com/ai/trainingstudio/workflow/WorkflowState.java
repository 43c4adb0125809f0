package com.ai.trainingstudio.workflow;

/**
 * IDLE → VALIDATING → SUBMITTING → RENDERED | DOWNLOADED | FAILED.
 * A new submission from any settled state starts over at VALIDATING.
 */
public enum WorkflowState {
    IDLE,
    VALIDATING,
    SUBMITTING,
    RENDERED,
    DOWNLOADED,
    FAILED;

    public boolean isSettled() {
        return this == RENDERED || this == DOWNLOADED || this == FAILED;
    }
}
