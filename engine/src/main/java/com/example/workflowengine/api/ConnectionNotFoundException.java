package com.example.workflowengine.api;

import lombok.Getter;

@Getter
public class ConnectionNotFoundException extends RuntimeException {

    private final String workflowId;
    private final String connectionId;

    public ConnectionNotFoundException(String workflowId, String connectionId) {
        super("Connection not found: " + connectionId + " in workflow " + workflowId);
        this.workflowId = workflowId;
        this.connectionId = connectionId;
    }
}
