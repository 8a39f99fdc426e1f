package com.example.workflowengine.api;

import lombok.Getter;

/**
 * Thrown when no execution with the given id is kept by the execution manager.
 */
@Getter
public class ExecutionNotFoundException extends RuntimeException {

    private final String executionId;

    public ExecutionNotFoundException(String executionId) {
        super("Execution not found: " + executionId);
        this.executionId = executionId;
    }
}
