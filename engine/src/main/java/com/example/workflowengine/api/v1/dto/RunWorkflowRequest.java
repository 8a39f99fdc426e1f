package com.example.workflowengine.api.v1.dto;

import java.util.Map;

/**
 * Request body for running a workflow: inputs handed to every input component and a run-wide context.
 */
public record RunWorkflowRequest(
        Map<String, Object> inputs,
        Map<String, Object> context
) {

    public RunWorkflowRequest {
        inputs = inputs != null ? inputs : Map.of();
        context = context != null ? context : Map.of();
    }
}
