package com.example.workflowengine.service;

import com.example.workflowengine.api.ExecutionNotFoundException;
import com.example.workflowengine.api.WorkflowNotFoundException;
import com.example.workflowengine.domain.ComponentType;
import com.example.workflowengine.domain.ExecutionStatus;
import com.example.workflowengine.domain.WorkflowExecution;
import com.example.workflowengine.engine.WorkflowExecutionManager;
import com.example.workflowengine.engine.WorkflowScheduler;
import com.example.workflowengine.executor.ComponentExecutorRegistry;
import com.example.workflowengine.executor.PassThroughExecutor;
import com.example.workflowengine.support.InMemoryWorkflowStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.example.workflowengine.support.Workflows.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WorkflowRunService")
class WorkflowRunServiceTest {

    private ExecutorService workers;
    private WorkflowRunService service;

    @BeforeEach
    void setUp() {
        workers = Executors.newFixedThreadPool(2);
        PassThroughExecutor passThrough = new PassThroughExecutor();
        WorkflowScheduler scheduler = new WorkflowScheduler(ComponentExecutorRegistry.builder()
                .register(ComponentType.INPUT, passThrough)
                .register(ComponentType.OUTPUT, passThrough)
                .build(), workers);
        InMemoryWorkflowStore store = new InMemoryWorkflowStore();
        store.save(workflow("w1").input("i").output("o").connect("i", "o").build());
        service = new WorkflowRunService(store, new WorkflowExecutionManager(scheduler, workers, 10));
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    @DisplayName("executes a stored workflow and keeps the execution")
    void executes() {
        WorkflowExecution execution = service.executeWorkflow("w1", Map.of("message", "hi"), Map.of());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(execution.results().get("o")).isEqualTo(Map.of("message", "hi"));
        assertThat(service.getExecution(execution.id())).isSameAs(execution);
        assertThat(service.listExecutions("w1")).containsExactly(execution);
        assertThat(service.cancelExecution(execution.id())).isFalse();
    }

    @Test
    @DisplayName("unknown workflow or execution ids raise not-found errors")
    void notFound() {
        assertThatThrownBy(() -> service.executeWorkflow("missing", Map.of(), Map.of()))
                .isInstanceOf(WorkflowNotFoundException.class);
        assertThatThrownBy(() -> service.startWorkflow("missing", Map.of(), Map.of()))
                .isInstanceOf(WorkflowNotFoundException.class);
        assertThatThrownBy(() -> service.getExecution("missing"))
                .isInstanceOf(ExecutionNotFoundException.class);
        assertThatThrownBy(() -> service.cancelExecution("missing"))
                .isInstanceOf(ExecutionNotFoundException.class);
    }
}
