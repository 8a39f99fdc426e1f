package com.example.workflowengine.api;

import lombok.Getter;

@Getter
public class ComponentNotFoundException extends RuntimeException {

    private final String workflowId;
    private final String componentId;

    public ComponentNotFoundException(String workflowId, String componentId) {
        super("Component not found: " + componentId + " in workflow " + workflowId);
        this.workflowId = workflowId;
        this.componentId = componentId;
    }
}
