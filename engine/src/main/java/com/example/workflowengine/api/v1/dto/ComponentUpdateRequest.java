package com.example.workflowengine.api.v1.dto;

import java.util.Map;

/**
 * Request body for editing a component. Null fields keep their current value; a component's id and
 * type cannot be changed.
 */
public record ComponentUpdateRequest(
        String name,
        String description,
        Map<String, Object> config
) {}
