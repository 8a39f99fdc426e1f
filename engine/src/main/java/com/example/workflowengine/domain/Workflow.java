package com.example.workflowengine.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Workflow definition: ordered components, ordered connections and free-form config.
 * <p>
 * Persisted as one JSON document per workflow (see {@link com.example.workflowengine.repository.WorkflowStore}).
 * Endpoint integrity of connections is checked by
 * {@link com.example.workflowengine.validation.WorkflowGraphValidator}, not here, so a definition
 * built around the validator still loads and runs.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Workflow(
        String id,
        String name,
        String description,
        List<Component> components,
        List<Connection> connections,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        Map<String, Object> config
) {

    public Workflow {
        Objects.requireNonNull(id, "id");
        components = components != null ? List.copyOf(components) : List.of();
        connections = connections != null ? List.copyOf(connections) : List.of();
        config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public Optional<Component> findComponent(String componentId) {
        return components.stream()
                .filter(c -> c.id().equals(componentId))
                .findFirst();
    }

    public Optional<Connection> findConnection(String connectionId) {
        return connections.stream()
                .filter(c -> c.id().equals(connectionId))
                .findFirst();
    }

    public boolean hasComponent(String componentId) {
        return findComponent(componentId).isPresent();
    }

    public Workflow withDetails(String newName, String newDescription, Map<String, Object> newConfig) {
        return new Workflow(id, newName, newDescription, components, connections, createdAt, updatedAt, newConfig);
    }

    public Workflow withGraph(List<Component> newComponents, List<Connection> newConnections) {
        return new Workflow(id, name, description, newComponents, newConnections, createdAt, updatedAt, config);
    }

    public Workflow withTimestamps(Instant newCreatedAt, Instant newUpdatedAt) {
        return new Workflow(id, name, description, components, connections, newCreatedAt, newUpdatedAt, config);
    }

    public Workflow withComponent(Component component) {
        List<Component> updated = new ArrayList<>(components);
        updated.add(component);
        return withGraph(updated, connections);
    }

    /**
     * Replaces the component with the same id, keeping its position in the list.
     */
    public Workflow replaceComponent(Component component) {
        List<Component> updated = components.stream()
                .map(c -> c.id().equals(component.id()) ? component : c)
                .toList();
        return withGraph(updated, connections);
    }

    /**
     * Removes the component and every connection touching it.
     */
    public Workflow withoutComponent(String componentId) {
        List<Component> remaining = components.stream()
                .filter(c -> !c.id().equals(componentId))
                .toList();
        List<Connection> remainingConnections = connections.stream()
                .filter(c -> !c.touches(componentId))
                .toList();
        return withGraph(remaining, remainingConnections);
    }

    public Workflow withConnection(Connection connection) {
        List<Connection> updated = new ArrayList<>(connections);
        updated.add(connection);
        return withGraph(components, updated);
    }

    public Workflow withoutConnection(String connectionId) {
        List<Connection> remaining = connections.stream()
                .filter(c -> !c.id().equals(connectionId))
                .toList();
        return withGraph(components, remaining);
    }
}
