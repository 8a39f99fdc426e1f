package com.example.workflowengine.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Directed edge: the target consumes the source's output. {@code config} is free-form and kept as stored.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Connection(
        String id,
        @JsonProperty("source_id") String sourceId,
        @JsonProperty("target_id") String targetId,
        @JsonProperty("source_port") String sourcePort,
        @JsonProperty("target_port") String targetPort,
        ConnectionType type,
        Map<String, Object> config
) {

    public Connection {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(targetId, "targetId");
        type = type != null ? type : ConnectionType.DATA;
        config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public static Connection of(String id, String sourceId, String targetId) {
        return new Connection(id, sourceId, targetId, null, null, ConnectionType.DATA, null);
    }

    public boolean touches(String componentId) {
        return sourceId.equals(componentId) || targetId.equals(componentId);
    }
}
