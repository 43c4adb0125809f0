package com.ai.trainingstudio.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of one operation. {@code message} is set on success,
 * {@code error} on failure, {@code result} carries the typed answer where
 * there is one.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationView {

    String operation;

    OperationStatus status;

    String message;

    String error;

    Object result;

    public static OperationView idle(String operation) {
        return OperationView.builder().operation(operation).status(OperationStatus.IDLE).build();
    }

    public OperationView inFlight() {
        return OperationView.builder().operation(operation).status(OperationStatus.IN_FLIGHT).build();
    }

    public OperationView succeeded(String message, Object result) {
        return OperationView.builder().operation(operation).status(OperationStatus.SUCCEEDED)
                .message(message).result(result).build();
    }

    public OperationView failed(String error) {
        return OperationView.builder().operation(operation).status(OperationStatus.FAILED).error(error).build();
    }

    @JsonIgnore
    public boolean isInFlight() {
        return status == OperationStatus.IN_FLIGHT;
    }
}
