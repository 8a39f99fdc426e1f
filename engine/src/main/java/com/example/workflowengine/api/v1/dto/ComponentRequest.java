package com.example.workflowengine.api.v1.dto;

import com.example.workflowengine.domain.Component;
import com.example.workflowengine.domain.ComponentType;

import jakarta.validation.constraints.NotNull;

import java.util.Map;
import java.util.UUID;

/**
 * Request body for adding a component. A blank id is replaced by a generated one.
 */
public record ComponentRequest(
        String id,
        String name,
        @NotNull ComponentType type,
        String description,
        Map<String, Object> config
) {

    public Component toComponent() {
        String componentId = id != null && !id.isBlank() ? id.trim() : UUID.randomUUID().toString();
        return new Component(componentId, name, type, description, config);
    }
}
