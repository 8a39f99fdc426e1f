package com.example.workflowengine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of component kinds a workflow graph may contain.
 * Each kind needs an entry in {@link com.example.workflowengine.executor.ComponentExecutorRegistry}.
 */
public enum ComponentType {

    AGENT("agent"),
    PLUGIN("plugin"),
    DATA_SOURCE("data_source"),
    INPUT("input"),
    OUTPUT("output");

    private final String value;

    ComponentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ComponentType fromValue(String value) {
        if (value != null) {
            for (ComponentType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown component type: " + value);
    }
}
