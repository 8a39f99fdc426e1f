package com.example.workflowengine.agent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reply of the agent service: generated message and optional token usage.
 */
public record AgentReply(String message, Map<String, Object> usage) {

    @SuppressWarnings("unchecked")
    static AgentReply from(Map<String, Object> body) {
        if (body == null) {
            return new AgentReply("", null);
        }
        Object message = body.get("message");
        Object usage = body.get("usage");
        return new AgentReply(
                message != null ? message.toString() : "",
                usage instanceof Map<?, ?> m ? new LinkedHashMap<>((Map<String, Object>) m) : null
        );
    }
}
