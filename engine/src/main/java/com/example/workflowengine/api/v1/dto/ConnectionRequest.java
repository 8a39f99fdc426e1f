package com.example.workflowengine.api.v1.dto;

import com.example.workflowengine.domain.Connection;
import com.example.workflowengine.domain.ConnectionType;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;
import java.util.UUID;

/**
 * Request body for adding a connection. A blank id is replaced by a generated one.
 */
public record ConnectionRequest(
        String id,
        @JsonProperty("source_id") @NotBlank String sourceId,
        @JsonProperty("target_id") @NotBlank String targetId,
        @JsonProperty("source_port") String sourcePort,
        @JsonProperty("target_port") String targetPort,
        ConnectionType type,
        Map<String, Object> config
) {

    public Connection toConnection() {
        String connectionId = id != null && !id.isBlank() ? id.trim() : UUID.randomUUID().toString();
        return new Connection(connectionId, sourceId, targetId, sourcePort, targetPort, type, config);
    }
}
