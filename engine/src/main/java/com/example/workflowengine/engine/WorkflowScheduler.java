package com.example.workflowengine.engine;

import com.example.workflowengine.domain.Component;
import com.example.workflowengine.domain.ComponentType;
import com.example.workflowengine.domain.Workflow;
import com.example.workflowengine.domain.WorkflowExecution;
import com.example.workflowengine.executor.ComponentErrors;
import com.example.workflowengine.executor.ComponentExecutor;
import com.example.workflowengine.executor.ComponentExecutorRegistry;
import com.example.workflowengine.graph.DependencyGraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives a workflow run over its dependency graph.
 * <p>
 * Input components are seeded with the caller's inputs. Every other component runs once all of
 * its dependencies have completed, on the shared worker pool, so independent components run
 * concurrently. A component's inputs are the results of its dependencies merged in dependency
 * order (connection declaration order); on a key collision the later dependency wins.
 * </p>
 * <p>
 * A component whose executor returns an error payload, or throws, is recorded in
 * {@code errors} and its dependents are never scheduled. Other branches keep running. Ready-set
 * bookkeeping and all writes to the {@link WorkflowExecution} happen on the calling thread; worker
 * threads only run executors.
 * </p>
 */
public class WorkflowScheduler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowScheduler.class);

    private final ComponentExecutorRegistry registry;
    private final ExecutorService workers;
    private final Clock clock;

    public WorkflowScheduler(ComponentExecutorRegistry registry, ExecutorService workers) {
        this(registry, workers, Clock.systemUTC());
    }

    public WorkflowScheduler(ComponentExecutorRegistry registry, ExecutorService workers, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public WorkflowExecution run(Workflow workflow, Map<String, Object> inputs, Map<String, Object> context) {
        return run(workflow, inputs, context, CancellationToken.none());
    }

    public WorkflowExecution run(Workflow workflow, Map<String, Object> inputs, Map<String, Object> context,
                                 CancellationToken cancellation) {
        WorkflowExecution execution = new WorkflowExecution(UUID.randomUUID().toString(), workflow.id());
        return run(execution, workflow, inputs, context, cancellation);
    }

    /**
     * Runs the workflow into an execution record created by the caller (still {@code pending}).
     * Returns once no component is ready or in flight; the record is then finished.
     */
    public WorkflowExecution run(WorkflowExecution execution, Workflow workflow, Map<String, Object> inputs,
                                 Map<String, Object> context, CancellationToken cancellation) {
        Objects.requireNonNull(execution, "execution");
        Objects.requireNonNull(workflow, "workflow");
        Objects.requireNonNull(cancellation, "cancellation");
        Map<String, Object> runInputs = inputs != null ? new LinkedHashMap<>(inputs) : new LinkedHashMap<>();
        Map<String, Object> runContext = context != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
                : Map.of();

        DependencyGraph graph = DependencyGraph.resolve(workflow);
        execution.start(clock.instant());
        log.info("Run started executionId={} workflowId={} components={} connections={}",
                execution.id(), workflow.id(), workflow.components().size(), workflow.connections().size());

        Run run = new Run(execution, workflow, graph, runContext, cancellation);
        try {
            run.seedInputs(runInputs);
            run.drive();
        } finally {
            execution.finish(clock.instant(), run.unreached(), cancellation.isCancelled());
        }
        log.info("Run finished executionId={} workflowId={} status={} results={} errors={} unreached={} cancelled={}",
                execution.id(), workflow.id(), execution.status().value(), execution.results().size(),
                execution.errors().size(), execution.unreached().size(), execution.cancelled());
        return execution;
    }

    private Instant now() {
        return clock.instant();
    }

    /**
     * State of one run. Only touched by the thread that called {@link #run}.
     */
    private final class Run {

        private final WorkflowExecution execution;
        private final Workflow workflow;
        private final DependencyGraph graph;
        private final Map<String, Object> context;
        private final CancellationToken cancellation;
        private final Map<String, Component> components = new LinkedHashMap<>();
        private final Map<String, Map<String, Object>> results = new HashMap<>();
        private final Set<String> completed = new HashSet<>();
        private final Set<String> failed = new HashSet<>();
        private final Set<String> dispatched = new HashSet<>();
        private final Set<String> ready = new LinkedHashSet<>();
        private final Map<Future<StepOutcome>, String> inFlight = new HashMap<>();
        private final CompletionService<StepOutcome> completion;

        private Run(WorkflowExecution execution, Workflow workflow, DependencyGraph graph,
                    Map<String, Object> context, CancellationToken cancellation) {
            this.execution = execution;
            this.workflow = workflow;
            this.graph = graph;
            this.context = context;
            this.cancellation = cancellation;
            this.completion = new ExecutorCompletionService<>(workers);
            for (Component component : workflow.components()) {
                components.putIfAbsent(component.id(), component);
            }
        }

        void seedInputs(Map<String, Object> inputs) {
            for (Component component : components.values()) {
                if (component.type() == ComponentType.INPUT) {
                    dispatched.add(component.id());
                    succeed(component.id(), inputs);
                }
            }
            for (String id : graph.initiallyReady()) {
                if (!completed.contains(id)) {
                    ready.add(id);
                }
            }
        }

        void drive() {
            while (true) {
                if (!cancellation.isCancelled()) {
                    dispatchReady();
                } else if (!ready.isEmpty()) {
                    log.info("Run cancelled executionId={} skippedReady={}", execution.id(), ready);
                    ready.clear();
                }
                if (inFlight.isEmpty()) {
                    return;
                }
                if (!awaitNext()) {
                    return;
                }
            }
        }

        private void dispatchReady() {
            while (!ready.isEmpty()) {
                Iterator<String> it = ready.iterator();
                String id = it.next();
                it.remove();
                if (completed.contains(id) || failed.contains(id) || !dispatched.add(id)) {
                    continue;
                }
                Component component = components.get(id);
                Optional<ComponentExecutor> executor = registry.executorFor(component.type());
                if (executor.isEmpty()) {
                    fail(id, "No executor registered for component type: " + component.type().value(), null);
                    continue;
                }
                Map<String, Object> inputs = gatherInputs(id);
                log.debug("Dispatching component id={} type={} inputKeys={} executionId={}",
                        id, component.type().value(), inputs.keySet(), execution.id());
                try {
                    Future<StepOutcome> future = completion.submit(() -> invoke(component, executor.get(), inputs));
                    inFlight.put(future, id);
                } catch (RejectedExecutionException e) {
                    log.error("Worker pool rejected component id={} executionId={}", id, execution.id());
                    fail(id, "Worker pool rejected component: " + e.getMessage(), null);
                }
            }
        }

        private StepOutcome invoke(Component component, ComponentExecutor executor, Map<String, Object> inputs) {
            try {
                return StepOutcome.success(component.id(), executor.execute(component, inputs, context));
            } catch (Exception e) {
                return StepOutcome.fault(component.id(), e);
            }
        }

        /**
         * Waits for the next finished component and records it.
         *
         * @return false when the wait was interrupted; the run is then cancelled
         */
        private boolean awaitNext() {
            Future<StepOutcome> future;
            try {
                future = completion.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellation.cancel();
                log.warn("Run interrupted executionId={} inFlight={}", execution.id(), inFlight.values());
                return false;
            }
            String id = inFlight.remove(future);
            StepOutcome outcome;
            try {
                outcome = future.get();
            } catch (ExecutionException e) {
                outcome = StepOutcome.fault(id, e.getCause() != null ? e.getCause() : e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = StepOutcome.fault(id, e);
            }
            apply(outcome);
            return true;
        }

        private void apply(StepOutcome outcome) {
            String id = outcome.componentId();
            if (outcome.fault() != null) {
                Throwable fault = outcome.fault();
                log.error("Error executing component id={} executionId={}: {}", id, execution.id(), fault.getMessage(), fault);
                fail(id, describe(fault), null);
                return;
            }
            Map<String, Object> output = outcome.output() != null ? outcome.output() : Map.of();
            if (ComponentErrors.isError(output)) {
                log.warn("Component id={} reported error executionId={}: {}", id, execution.id(), ComponentErrors.message(output));
                fail(id, ComponentErrors.message(output), output);
                return;
            }
            succeed(id, output);
        }

        private Map<String, Object> gatherInputs(String id) {
            Map<String, Object> merged = new LinkedHashMap<>();
            for (String dependency : graph.dependencies(id)) {
                Map<String, Object> result = results.get(dependency);
                if (result != null) {
                    merged.putAll(result);
                }
            }
            return merged;
        }

        private void succeed(String id, Map<String, Object> output) {
            Map<String, Object> stored = new LinkedHashMap<>(output);
            results.put(id, stored);
            completed.add(id);
            execution.recordResult(id, stored, now());
            for (String dependent : graph.dependents(id)) {
                if (!dispatched.contains(dependent) && graph.isSatisfied(dependent, completed)) {
                    ready.add(dependent);
                }
            }
        }

        private void fail(String id, String error, Map<String, Object> details) {
            failed.add(id);
            execution.recordError(id, error, details, now());
        }

        /**
         * Components never dispatched. A component abandoned in flight by an interrupt was
         * dispatched, so it is not listed even though it has no result.
         */
        Set<String> unreached() {
            Set<String> unreached = new LinkedHashSet<>();
            for (String id : components.keySet()) {
                if (!dispatched.contains(id)) {
                    unreached.add(id);
                }
            }
            if (!unreached.isEmpty()) {
                log.debug("Unreached components executionId={} workflowId={} ids={}", execution.id(), workflow.id(), unreached);
            }
            return unreached;
        }

        private String describe(Throwable fault) {
            return fault.getMessage() != null ? fault.getMessage() : fault.getClass().getSimpleName();
        }
    }

    private record StepOutcome(String componentId, Map<String, Object> output, Throwable fault) {

        static StepOutcome success(String componentId, Map<String, Object> output) {
            return new StepOutcome(componentId, output, null);
        }

        static StepOutcome fault(String componentId, Throwable fault) {
            return new StepOutcome(componentId, null, fault);
        }
    }
}
