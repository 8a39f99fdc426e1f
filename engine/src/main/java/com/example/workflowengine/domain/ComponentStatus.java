package com.example.workflowengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one component within a run.
 */
public enum ComponentStatus {

    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    ComponentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
