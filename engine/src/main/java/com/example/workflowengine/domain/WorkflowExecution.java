package com.example.workflowengine.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Record of a single workflow run: status, per-component results and errors, and the ordered log.
 * <p>
 * Written only by the scheduler driving the run; any thread may read it while the run is in
 * progress. Accessors return copies taken under the record's lock. Once {@link #finish} has set
 * the end time the record is frozen and every further write throws {@link IllegalStateException}.
 * </p>
 * <p>
 * A component that appears in neither {@link #results()} nor {@link #errors()} was never reached
 * (behind a cycle, behind a failed dependency, or not dispatched after cancellation); such ids are
 * listed in {@link #unreached()}.
 * </p>
 */
public class WorkflowExecution {

    private final String id;
    private final String workflowId;
    private ExecutionStatus status = ExecutionStatus.PENDING;
    private Instant startTime;
    private Instant endTime;
    private final Map<String, Map<String, Object>> results = new LinkedHashMap<>();
    private final Map<String, String> errors = new LinkedHashMap<>();
    private final List<ExecutionLogEntry> logs = new ArrayList<>();
    private final Set<String> unreached = new LinkedHashSet<>();
    private boolean cancelled;

    public WorkflowExecution(String id, String workflowId) {
        this.id = Objects.requireNonNull(id, "id");
        this.workflowId = Objects.requireNonNull(workflowId, "workflowId");
    }

    public synchronized void start(Instant at) {
        if (status != ExecutionStatus.PENDING) {
            throw new IllegalStateException("Execution " + id + " cannot start from status " + status.value());
        }
        status = ExecutionStatus.RUNNING;
        startTime = Objects.requireNonNull(at, "at");
    }

    public synchronized void recordResult(String componentId, Map<String, Object> result, Instant at) {
        ensureRecordable(componentId);
        Map<String, Object> copy = Collections.unmodifiableMap(new LinkedHashMap<>(result));
        results.put(componentId, copy);
        logs.add(ExecutionLogEntry.completed(componentId, at, copy));
    }

    public synchronized void recordError(String componentId, String error, Map<String, Object> details, Instant at) {
        ensureRecordable(componentId);
        String message = error != null ? error : "Unknown error";
        errors.put(componentId, message);
        Map<String, Object> detailsCopy = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : null;
        logs.add(ExecutionLogEntry.failed(componentId, at, message, detailsCopy));
    }

    /**
     * Ends the run. Status becomes {@code failed} when any component recorded an error, else {@code completed}.
     */
    public synchronized void finish(Instant at, Set<String> unreachedComponents, boolean wasCancelled) {
        if (endTime != null) {
            throw new IllegalStateException("Execution " + id + " already finished");
        }
        if (status == ExecutionStatus.PENDING) {
            startTime = at;
        }
        endTime = Objects.requireNonNull(at, "at");
        if (unreachedComponents != null) {
            unreached.addAll(unreachedComponents);
        }
        cancelled = wasCancelled;
        status = errors.isEmpty() ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED;
    }

    private void ensureRecordable(String componentId) {
        if (status != ExecutionStatus.RUNNING || endTime != null) {
            throw new IllegalStateException("Execution " + id + " is not running (status " + status.value() + ")");
        }
        if (results.containsKey(componentId) || errors.containsKey(componentId)) {
            throw new IllegalStateException("Outcome of component " + componentId + " already recorded");
        }
    }

    public String id() {
        return id;
    }

    public String workflowId() {
        return workflowId;
    }

    public synchronized ExecutionStatus status() {
        return status;
    }

    public synchronized Instant startTime() {
        return startTime;
    }

    public synchronized Instant endTime() {
        return endTime;
    }

    public synchronized boolean isFinished() {
        return endTime != null;
    }

    public synchronized boolean cancelled() {
        return cancelled;
    }

    public synchronized Map<String, Map<String, Object>> results() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public synchronized Map<String, String> errors() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public synchronized List<ExecutionLogEntry> logs() {
        return List.copyOf(logs);
    }

    public synchronized Set<String> unreached() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(unreached));
    }

    @Override
    public String toString() {
        return "WorkflowExecution{id=" + id + ", workflowId=" + workflowId + ", status=" + status() + "}";
    }
}
