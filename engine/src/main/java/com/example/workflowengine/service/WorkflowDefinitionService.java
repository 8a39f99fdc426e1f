package com.example.workflowengine.service;

import com.example.workflowengine.api.ComponentNotFoundException;
import com.example.workflowengine.api.ConnectionNotFoundException;
import com.example.workflowengine.api.WorkflowNotFoundException;
import com.example.workflowengine.api.v1.dto.ComponentRequest;
import com.example.workflowengine.api.v1.dto.ComponentUpdateRequest;
import com.example.workflowengine.api.v1.dto.ConnectionRequest;
import com.example.workflowengine.api.v1.dto.WorkflowCreateRequest;
import com.example.workflowengine.api.v1.dto.WorkflowListItem;
import com.example.workflowengine.api.v1.dto.WorkflowUpdateRequest;
import com.example.workflowengine.domain.Component;
import com.example.workflowengine.domain.Connection;
import com.example.workflowengine.domain.Workflow;
import com.example.workflowengine.repository.WorkflowStore;
import com.example.workflowengine.validation.WorkflowGraphValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Application service for workflow definitions: CRUD and graph editing.
 * <p>
 * Every change is validated with {@link WorkflowGraphValidator}, bumps {@code updated_at} and is
 * saved through the {@link WorkflowStore}.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowDefinitionService {

    private final WorkflowStore store;

    public Workflow create(WorkflowCreateRequest request) {
        log.debug("Creating workflow name={} components={} connections={}", request.name(),
                request.components() != null ? request.components().size() : 0,
                request.connections() != null ? request.connections().size() : 0);
        Instant now = Instant.now();
        Workflow workflow = new Workflow(
                UUID.randomUUID().toString(),
                request.name(),
                request.description(),
                toComponents(request.components()),
                toConnections(request.connections()),
                now,
                now,
                request.config());
        return validateAndSave(workflow);
    }

    /**
     * Saves a complete workflow under its own id, keeping the creation time of an existing one.
     */
    public Workflow importWorkflow(Workflow workflow) {
        Instant now = Instant.now();
        Instant createdAt = store.load(workflow.id())
                .map(Workflow::createdAt)
                .orElse(workflow.createdAt() != null ? workflow.createdAt() : now);
        return validateAndSave(workflow.withTimestamps(createdAt, now));
    }

    public List<WorkflowListItem> findAll() {
        List<WorkflowListItem> list = store.list().stream()
                .map(WorkflowListItem::from)
                .toList();
        log.debug("findAll returned {} workflows", list.size());
        return list;
    }

    public Workflow findById(String id) {
        log.debug("Finding workflow by id={}", id);
        return store.load(id).orElseThrow(() -> new WorkflowNotFoundException(id));
    }

    public Workflow update(String id, WorkflowUpdateRequest request) {
        log.debug("Updating workflow id={} name={}", id, request.name());
        Workflow existing = findById(id);
        Workflow updated = existing.withDetails(
                request.name() != null ? request.name() : existing.name(),
                request.description() != null ? request.description() : existing.description(),
                request.config() != null ? request.config() : existing.config());
        if (request.components() != null || request.connections() != null) {
            updated = updated.withGraph(
                    request.components() != null ? toComponents(request.components()) : existing.components(),
                    request.connections() != null ? toConnections(request.connections()) : existing.connections());
        }
        return touchAndSave(updated);
    }

    public void delete(String id) {
        log.debug("Deleting workflow id={}", id);
        if (!store.delete(id)) {
            throw new WorkflowNotFoundException(id);
        }
    }

    public Component addComponent(String workflowId, ComponentRequest request) {
        Workflow workflow = findById(workflowId);
        Component component = request.toComponent();
        touchAndSave(workflow.withComponent(component));
        log.debug("Added component id={} type={} workflowId={}", component.id(), component.type().value(), workflowId);
        return component;
    }

    public Component updateComponent(String workflowId, String componentId, ComponentUpdateRequest request) {
        Workflow workflow = findById(workflowId);
        Component component = workflow.findComponent(componentId)
                .orElseThrow(() -> new ComponentNotFoundException(workflowId, componentId));
        if (request.name() != null) {
            component = component.withName(request.name());
        }
        if (request.description() != null) {
            component = component.withDescription(request.description());
        }
        if (request.config() != null) {
            component = component.withConfig(request.config());
        }
        touchAndSave(workflow.replaceComponent(component));
        log.debug("Updated component id={} workflowId={}", componentId, workflowId);
        return component;
    }

    /**
     * Removes the component together with every connection touching it.
     */
    public void deleteComponent(String workflowId, String componentId) {
        Workflow workflow = findById(workflowId);
        if (!workflow.hasComponent(componentId)) {
            throw new ComponentNotFoundException(workflowId, componentId);
        }
        Workflow updated = workflow.withoutComponent(componentId);
        touchAndSave(updated);
        log.debug("Deleted component id={} workflowId={} droppedConnections={}", componentId, workflowId,
                workflow.connections().size() - updated.connections().size());
    }

    public Connection addConnection(String workflowId, ConnectionRequest request) {
        Workflow workflow = findById(workflowId);
        Connection connection = request.toConnection();
        touchAndSave(workflow.withConnection(connection));
        log.debug("Added connection id={} {} -> {} workflowId={}", connection.id(), connection.sourceId(),
                connection.targetId(), workflowId);
        return connection;
    }

    public void deleteConnection(String workflowId, String connectionId) {
        Workflow workflow = findById(workflowId);
        if (workflow.findConnection(connectionId).isEmpty()) {
            throw new ConnectionNotFoundException(workflowId, connectionId);
        }
        touchAndSave(workflow.withoutConnection(connectionId));
        log.debug("Deleted connection id={} workflowId={}", connectionId, workflowId);
    }

    private Workflow touchAndSave(Workflow workflow) {
        return validateAndSave(workflow.withTimestamps(workflow.createdAt(), Instant.now()));
    }

    private Workflow validateAndSave(Workflow workflow) {
        WorkflowGraphValidator.validate(workflow);
        Workflow saved = store.save(workflow);
        log.debug("Persisted workflow id={} components={} connections={}", saved.id(),
                saved.components().size(), saved.connections().size());
        return saved;
    }

    private static List<Component> toComponents(List<ComponentRequest> requests) {
        return requests != null ? requests.stream().map(ComponentRequest::toComponent).toList() : List.of();
    }

    private static List<Connection> toConnections(List<ConnectionRequest> requests) {
        return requests != null ? requests.stream().map(ConnectionRequest::toConnection).toList() : List.of();
    }
}
