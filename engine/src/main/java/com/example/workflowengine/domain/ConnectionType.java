package com.example.workflowengine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tag on a connection. Informational only: every connection type is scheduled as a plain dependency.
 */
public enum ConnectionType {

    DATA("data"),
    CONTROL("control"),
    CONTEXT("context");

    private final String value;

    ConnectionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConnectionType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DATA;
        }
        for (ConnectionType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown connection type: " + value);
    }
}
