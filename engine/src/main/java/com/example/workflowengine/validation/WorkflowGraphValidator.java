package com.example.workflowengine.validation;

import com.example.workflowengine.domain.Component;
import com.example.workflowengine.domain.ComponentType;
import com.example.workflowengine.domain.Connection;
import com.example.workflowengine.domain.Workflow;
import com.example.workflowengine.graph.DependencyGraph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a workflow definition: required fields, id uniqueness, connection endpoints, cycles and
 * the handler settings of plugin and data-source components.
 */
public final class WorkflowGraphValidator {

    private WorkflowGraphValidator() {
    }

    /**
     * Validates the workflow. Throws {@link WorkflowGraphValidationException} with all errors if invalid.
     */
    public static void validate(Workflow workflow) {
        List<ValidationError> errors = new ArrayList<>();

        if (workflow.name() == null || workflow.name().isBlank()) {
            errors.add(new ValidationError("name", "name is required"));
        }

        Set<String> componentIds = new HashSet<>();
        for (Component component : workflow.components()) {
            validateComponent(component, componentIds, errors);
        }

        Set<String> connectionIds = new HashSet<>();
        for (Connection connection : workflow.connections()) {
            validateConnection(connection, componentIds, connectionIds, errors);
        }

        if (errors.isEmpty()) {
            Optional<List<String>> cycle = DependencyGraph.resolve(workflow).findCycle();
            cycle.ifPresent(path -> errors.add(
                    new ValidationError("connections", "connections form a cycle: " + String.join(" -> ", path))));
        }

        if (!errors.isEmpty()) {
            throw new WorkflowGraphValidationException(errors);
        }
    }

    private static void validateComponent(Component component, Set<String> seenIds, List<ValidationError> errors) {
        String prefix = "components[" + component.id() + "]";
        if (component.id().isBlank()) {
            errors.add(new ValidationError(prefix + ".id", "component id is required"));
        } else if (!seenIds.add(component.id())) {
            errors.add(new ValidationError(prefix + ".id", "duplicate component id: " + component.id()));
        }
        if (component.type() == ComponentType.PLUGIN && component.configString(Component.PLUGIN_TYPE) == null) {
            errors.add(new ValidationError(prefix + ".config.plugin_type", "plugin components require plugin_type"));
        }
        if (component.type() == ComponentType.DATA_SOURCE && component.configString(Component.SOURCE_TYPE) == null) {
            errors.add(new ValidationError(prefix + ".config.source_type", "data_source components require source_type"));
        }
    }

    private static void validateConnection(Connection connection, Set<String> componentIds, Set<String> seenIds,
                                           List<ValidationError> errors) {
        String prefix = "connections[" + connection.id() + "]";
        if (connection.id().isBlank()) {
            errors.add(new ValidationError(prefix + ".id", "connection id is required"));
        } else if (!seenIds.add(connection.id())) {
            errors.add(new ValidationError(prefix + ".id", "duplicate connection id: " + connection.id()));
        }
        if (!componentIds.contains(connection.sourceId())) {
            errors.add(new ValidationError(prefix + ".source_id",
                    "source_id must reference an existing component id: " + connection.sourceId()));
        }
        if (!componentIds.contains(connection.targetId())) {
            errors.add(new ValidationError(prefix + ".target_id",
                    "target_id must reference an existing component id: " + connection.targetId()));
        }
        if (connection.sourceId().equals(connection.targetId())) {
            errors.add(new ValidationError(prefix, "connection must not link a component to itself"));
        }
    }
}
