package com.example.workflowengine.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Request body for the agent service {@code POST /chat}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentChatRequest(
        String message,
        List<Map<String, Object>> history,
        @JsonProperty("agent_id") String agentId
) {
    public AgentChatRequest {
        message = message != null ? message : "";
        history = history != null ? List.copyOf(history) : List.of();
    }
}
