package com.example.workflowengine.api.v1;

import com.example.workflowengine.api.v1.dto.ComponentRequest;
import com.example.workflowengine.api.v1.dto.ComponentUpdateRequest;
import com.example.workflowengine.api.v1.dto.ConnectionRequest;
import com.example.workflowengine.api.v1.dto.ExecutionResponse;
import com.example.workflowengine.api.v1.dto.RunWorkflowRequest;
import com.example.workflowengine.api.v1.dto.WorkflowCreateRequest;
import com.example.workflowengine.api.v1.dto.WorkflowIdResponse;
import com.example.workflowengine.api.v1.dto.WorkflowListResponse;
import com.example.workflowengine.api.v1.dto.WorkflowUpdateRequest;
import com.example.workflowengine.domain.Component;
import com.example.workflowengine.domain.Connection;
import com.example.workflowengine.domain.Workflow;
import com.example.workflowengine.domain.WorkflowExecution;
import com.example.workflowengine.service.WorkflowDefinitionService;
import com.example.workflowengine.service.WorkflowRunService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for workflow definitions and their runs.
 * <p>
 * Exposes {@code /api/v1/workflows} for CRUD, component and connection editing under
 * {@code /{id}/components} and {@code /{id}/connections}, a synchronous run
 * ({@code POST /{id}/execute}) and a background run ({@code POST /{id}/executions}, 202).
 * </p>
 */
@RestController
@RequestMapping("/api/v1/workflows")
@RequiredArgsConstructor
@Slf4j
public class WorkflowController {

    private final WorkflowDefinitionService service;
    private final WorkflowRunService runService;

    @PostMapping
    public ResponseEntity<WorkflowIdResponse> create(@Valid @RequestBody WorkflowCreateRequest request) {
        log.info("Creating workflow name={}", request.name());
        Workflow created = service.create(request);
        log.info("Created workflow id={} name={}", created.id(), created.name());
        return ResponseEntity.status(HttpStatus.CREATED).body(new WorkflowIdResponse(created.id()));
    }

    @GetMapping
    public ResponseEntity<WorkflowListResponse> list() {
        log.debug("Listing all workflows");
        return ResponseEntity.ok(new WorkflowListResponse(service.findAll()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Workflow> getById(@PathVariable String id) {
        log.info("Getting workflow id={}", id);
        return ResponseEntity.ok(service.findById(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Workflow> update(@PathVariable String id, @Valid @RequestBody WorkflowUpdateRequest request) {
        log.info("Updating workflow id={} name={}", id, request.name());
        return ResponseEntity.ok(service.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        log.info("Deleting workflow id={}", id);
        service.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/components")
    public ResponseEntity<Component> addComponent(@PathVariable String id, @Valid @RequestBody ComponentRequest request) {
        log.info("Adding component workflowId={} type={}", id, request.type());
        return ResponseEntity.status(HttpStatus.CREATED).body(service.addComponent(id, request));
    }

    @PatchMapping("/{id}/components/{componentId}")
    public ResponseEntity<Component> updateComponent(@PathVariable String id, @PathVariable String componentId,
                                                     @RequestBody ComponentUpdateRequest request) {
        log.info("Updating component workflowId={} componentId={}", id, componentId);
        return ResponseEntity.ok(service.updateComponent(id, componentId, request));
    }

    @DeleteMapping("/{id}/components/{componentId}")
    public ResponseEntity<Void> deleteComponent(@PathVariable String id, @PathVariable String componentId) {
        log.info("Deleting component workflowId={} componentId={}", id, componentId);
        service.deleteComponent(id, componentId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/connections")
    public ResponseEntity<Connection> addConnection(@PathVariable String id, @Valid @RequestBody ConnectionRequest request) {
        log.info("Adding connection workflowId={} {} -> {}", id, request.sourceId(), request.targetId());
        return ResponseEntity.status(HttpStatus.CREATED).body(service.addConnection(id, request));
    }

    @DeleteMapping("/{id}/connections/{connectionId}")
    public ResponseEntity<Void> deleteConnection(@PathVariable String id, @PathVariable String connectionId) {
        log.info("Deleting connection workflowId={} connectionId={}", id, connectionId);
        service.deleteConnection(id, connectionId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/execute")
    public ResponseEntity<ExecutionResponse> execute(@PathVariable String id,
                                                     @RequestBody(required = false) RunWorkflowRequest request) {
        RunWorkflowRequest run = request != null ? request : new RunWorkflowRequest(null, null);
        log.info("Executing workflow id={} inputKeys={}", id, run.inputs().keySet());
        WorkflowExecution execution = runService.executeWorkflow(id, run.inputs(), run.context());
        return ResponseEntity.ok(ExecutionResponse.from(execution));
    }

    @PostMapping("/{id}/executions")
    public ResponseEntity<ExecutionResponse> start(@PathVariable String id,
                                                   @RequestBody(required = false) RunWorkflowRequest request) {
        RunWorkflowRequest run = request != null ? request : new RunWorkflowRequest(null, null);
        log.info("Starting workflow id={} inputKeys={}", id, run.inputs().keySet());
        WorkflowExecution execution = runService.startWorkflow(id, run.inputs(), run.context());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ExecutionResponse.from(execution));
    }
}
