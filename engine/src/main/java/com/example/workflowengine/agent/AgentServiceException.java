package com.example.workflowengine.agent;

import lombok.Getter;

/**
 * Thrown when the agent service answers with a non-2xx status.
 */
@Getter
public class AgentServiceException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;

    public AgentServiceException(int statusCode, String responseBody) {
        super("Agent service returned HTTP " + statusCode);
        this.statusCode = statusCode;
        this.responseBody = responseBody != null ? responseBody : "";
    }
}
