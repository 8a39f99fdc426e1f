package com.example.workflowengine.api.v1.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.List;
import java.util.Map;

/**
 * Request body for creating a workflow. Components and connections are optional; a workflow is
 * usually created empty and edited through the component and connection endpoints.
 */
public record WorkflowCreateRequest(
        @NotBlank String name,
        String description,
        Map<String, Object> config,
        @Valid List<ComponentRequest> components,
        @Valid List<ConnectionRequest> connections
) {

    public WorkflowCreateRequest(String name, String description) {
        this(name, description, null, null, null);
    }
}
