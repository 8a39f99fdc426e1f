package com.example.workflowengine.engine;

import com.example.workflowengine.domain.Workflow;
import com.example.workflowengine.domain.WorkflowExecution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Starts workflow runs and keeps their execution records for lookup.
 * <p>
 * A record is registered before its run starts, so {@link #get} shows live progress of both
 * synchronous and asynchronous runs. At most {@code historyLimit} finished records are kept;
 * the oldest finished ones are evicted first. Records of active runs are never evicted.
 * </p>
 */
public class WorkflowExecutionManager {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutionManager.class);

    private final WorkflowScheduler scheduler;
    private final Executor runExecutor;
    private final int historyLimit;

    private final Map<String, WorkflowExecution> executions = new LinkedHashMap<>();
    private final Map<String, CancellationToken> tokens = new LinkedHashMap<>();

    public WorkflowExecutionManager(WorkflowScheduler scheduler, Executor runExecutor, int historyLimit) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be at least 1, was " + historyLimit);
        }
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.runExecutor = Objects.requireNonNull(runExecutor, "runExecutor");
        this.historyLimit = historyLimit;
    }

    /**
     * Runs the workflow on the calling thread and returns the finished record.
     */
    public WorkflowExecution execute(Workflow workflow, Map<String, Object> inputs, Map<String, Object> context) {
        WorkflowExecution execution = register(workflow);
        CancellationToken token = tokenOf(execution.id());
        try {
            return scheduler.run(execution, workflow, inputs, context, token);
        } finally {
            completed(execution.id());
        }
    }

    /**
     * Registers the run and hands it to the run executor. The returned record is still pending or running.
     */
    public WorkflowExecution start(Workflow workflow, Map<String, Object> inputs, Map<String, Object> context) {
        WorkflowExecution execution = register(workflow);
        CancellationToken token = tokenOf(execution.id());
        Map<String, Object> runInputs = inputs != null ? new LinkedHashMap<>(inputs) : Map.of();
        Map<String, Object> runContext = context != null ? new LinkedHashMap<>(context) : Map.of();
        try {
            runExecutor.execute(() -> {
                try {
                    scheduler.run(execution, workflow, runInputs, runContext, token);
                } catch (RuntimeException e) {
                    log.error("Run aborted executionId={} workflowId={}: {}", execution.id(), workflow.id(), e.getMessage(), e);
                } finally {
                    completed(execution.id());
                }
            });
        } catch (RejectedExecutionException e) {
            synchronized (this) {
                executions.remove(execution.id());
                tokens.remove(execution.id());
            }
            throw e;
        }
        log.info("Run submitted executionId={} workflowId={}", execution.id(), workflow.id());
        return execution;
    }

    public synchronized Optional<WorkflowExecution> get(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    /**
     * Lists records in start order, optionally only those of one workflow.
     */
    public synchronized List<WorkflowExecution> list(String workflowId) {
        List<WorkflowExecution> list = new ArrayList<>();
        for (WorkflowExecution execution : executions.values()) {
            if (workflowId == null || workflowId.equals(execution.workflowId())) {
                list.add(execution);
            }
        }
        return list;
    }

    /**
     * Stops the run from dispatching further components.
     *
     * @return true when the run was known and still active
     */
    public boolean cancel(String executionId) {
        CancellationToken token;
        synchronized (this) {
            token = tokens.get(executionId);
        }
        if (token == null) {
            return false;
        }
        boolean cancelled = token.cancel();
        if (cancelled) {
            log.info("Cancellation requested executionId={}", executionId);
        }
        return cancelled;
    }

    private synchronized WorkflowExecution register(Workflow workflow) {
        Objects.requireNonNull(workflow, "workflow");
        WorkflowExecution execution = new WorkflowExecution(UUID.randomUUID().toString(), workflow.id());
        executions.put(execution.id(), execution);
        tokens.put(execution.id(), new CancellationToken());
        evictFinished();
        return execution;
    }

    private synchronized CancellationToken tokenOf(String executionId) {
        return tokens.get(executionId);
    }

    private synchronized void completed(String executionId) {
        tokens.remove(executionId);
        evictFinished();
    }

    private void evictFinished() {
        long finished = executions.values().stream().filter(WorkflowExecution::isFinished).count();
        Iterator<WorkflowExecution> it = executions.values().iterator();
        while (finished > historyLimit && it.hasNext()) {
            WorkflowExecution execution = it.next();
            if (execution.isFinished()) {
                it.remove();
                finished--;
                log.debug("Evicted execution executionId={} workflowId={}", execution.id(), execution.workflowId());
            }
        }
    }
}
