package com.example.workflowengine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response for POST /api/v1/executions/{id}/cancel. {@code cancelled} is false when the run had already finished.
 */
public record CancelExecutionResponse(
        @JsonProperty("execution_id") String executionId,
        boolean cancelled
) {}
