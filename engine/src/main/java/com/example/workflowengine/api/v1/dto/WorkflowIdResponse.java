package com.example.workflowengine.api.v1.dto;

/**
 * Response after creating a workflow (201): only the id.
 */
public record WorkflowIdResponse(String id) {}
