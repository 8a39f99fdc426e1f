package com.example.workflowengine.api.v1.dto;

import jakarta.validation.Valid;

import java.util.List;
import java.util.Map;

/**
 * Request body for updating a workflow. Null fields keep their current value; non-null
 * {@code components} or {@code connections} replace the whole list.
 */
public record WorkflowUpdateRequest(
        String name,
        String description,
        Map<String, Object> config,
        @Valid List<ComponentRequest> components,
        @Valid List<ConnectionRequest> connections
) {}
