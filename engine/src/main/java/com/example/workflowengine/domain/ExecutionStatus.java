package com.example.workflowengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Run status: {@code pending -> running -> completed | failed}. Completed and failed are terminal.
 */
public enum ExecutionStatus {

    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
