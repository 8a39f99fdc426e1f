package com.example.workflowengine.api.v1.dto;

import com.example.workflowengine.domain.ExecutionLogEntry;
import com.example.workflowengine.domain.WorkflowExecution;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Snapshot of an execution record as returned by the API.
 */
public record ExecutionResponse(
        String id,
        @JsonProperty("workflow_id") String workflowId,
        String status,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        Map<String, Map<String, Object>> results,
        Map<String, String> errors,
        List<ExecutionLogEntry> logs,
        Set<String> unreached,
        boolean cancelled
) {

    public static ExecutionResponse from(WorkflowExecution execution) {
        return new ExecutionResponse(
                execution.id(),
                execution.workflowId(),
                execution.status().value(),
                execution.startTime(),
                execution.endTime(),
                execution.results(),
                execution.errors(),
                execution.logs(),
                execution.unreached(),
                execution.cancelled());
    }
}
