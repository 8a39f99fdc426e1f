package com.example.workflowengine.service;

import com.example.workflowengine.api.ExecutionNotFoundException;
import com.example.workflowengine.api.WorkflowNotFoundException;
import com.example.workflowengine.domain.Workflow;
import com.example.workflowengine.domain.WorkflowExecution;
import com.example.workflowengine.engine.WorkflowExecutionManager;
import com.example.workflowengine.repository.WorkflowStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Runs stored workflows and exposes their execution records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowRunService {

    private final WorkflowStore store;
    private final WorkflowExecutionManager executionManager;

    /**
     * Runs the workflow with the given id to completion.
     *
     * @throws WorkflowNotFoundException if the workflow does not exist
     */
    public WorkflowExecution executeWorkflow(String workflowId, Map<String, Object> inputs, Map<String, Object> context) {
        Workflow workflow = load(workflowId);
        log.info("Execute workflow id={} name={} inputKeys={}", workflowId, workflow.name(),
                inputs != null ? inputs.keySet() : List.of());
        return executionManager.execute(workflow, inputs, context);
    }

    /**
     * Starts the workflow in the background and returns its record right away.
     *
     * @throws WorkflowNotFoundException if the workflow does not exist
     */
    public WorkflowExecution startWorkflow(String workflowId, Map<String, Object> inputs, Map<String, Object> context) {
        Workflow workflow = load(workflowId);
        log.info("Start workflow id={} name={} inputKeys={}", workflowId, workflow.name(),
                inputs != null ? inputs.keySet() : List.of());
        return executionManager.start(workflow, inputs, context);
    }

    public WorkflowExecution getExecution(String executionId) {
        return executionManager.get(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }

    public List<WorkflowExecution> listExecutions(String workflowId) {
        return executionManager.list(workflowId);
    }

    /**
     * @return false when the run had already finished
     * @throws ExecutionNotFoundException if no such execution is kept
     */
    public boolean cancelExecution(String executionId) {
        getExecution(executionId);
        return executionManager.cancel(executionId);
    }

    private Workflow load(String workflowId) {
        return store.load(workflowId).orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }
}
