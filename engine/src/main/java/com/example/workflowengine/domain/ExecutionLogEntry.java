package com.example.workflowengine.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of an execution log. Completed entries carry {@code result}; failed entries carry
 * {@code error} and, for component-level errors, the structured payload in {@code details}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionLogEntry(
        @JsonProperty("component_id") String componentId,
        Instant timestamp,
        ComponentStatus status,
        Map<String, Object> result,
        String error,
        Map<String, Object> details
) {

    public ExecutionLogEntry {
        Objects.requireNonNull(componentId, "componentId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(status, "status");
    }

    public static ExecutionLogEntry completed(String componentId, Instant timestamp, Map<String, Object> result) {
        return new ExecutionLogEntry(componentId, timestamp, ComponentStatus.COMPLETED, result, null, null);
    }

    public static ExecutionLogEntry failed(String componentId, Instant timestamp, String error, Map<String, Object> details) {
        return new ExecutionLogEntry(componentId, timestamp, ComponentStatus.FAILED, null, error, details);
    }
}
