package com.example.workflowengine.api.v1.dto;

import com.example.workflowengine.domain.Workflow;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Workflow list item: id, name, graph size and last update.
 */
public record WorkflowListItem(
        String id,
        String name,
        String description,
        @JsonProperty("component_count") int componentCount,
        @JsonProperty("connection_count") int connectionCount,
        @JsonProperty("updated_at") Instant updatedAt
) {

    public static WorkflowListItem from(Workflow workflow) {
        return new WorkflowListItem(
                workflow.id(),
                workflow.name(),
                workflow.description(),
                workflow.components().size(),
                workflow.connections().size(),
                workflow.updatedAt());
    }
}
