package com.example.workflowengine.service;

import com.example.workflowengine.api.ComponentNotFoundException;
import com.example.workflowengine.api.ConnectionNotFoundException;
import com.example.workflowengine.api.WorkflowNotFoundException;
import com.example.workflowengine.api.v1.dto.ComponentRequest;
import com.example.workflowengine.api.v1.dto.ComponentUpdateRequest;
import com.example.workflowengine.api.v1.dto.ConnectionRequest;
import com.example.workflowengine.api.v1.dto.WorkflowCreateRequest;
import com.example.workflowengine.api.v1.dto.WorkflowUpdateRequest;
import com.example.workflowengine.domain.Component;
import com.example.workflowengine.domain.ComponentType;
import com.example.workflowengine.domain.Connection;
import com.example.workflowengine.domain.Workflow;
import com.example.workflowengine.support.InMemoryWorkflowStore;
import com.example.workflowengine.validation.WorkflowGraphValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.workflowengine.support.Workflows.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WorkflowDefinitionService")
class WorkflowDefinitionServiceTest {

    private InMemoryWorkflowStore store;
    private WorkflowDefinitionService service;
    private String workflowId;

    @BeforeEach
    void setUp() {
        store = new InMemoryWorkflowStore();
        service = new WorkflowDefinitionService(store);
        workflowId = service.create(new WorkflowCreateRequest("Flow", "demo")).id();
    }

    private ComponentRequest component(String id, ComponentType type, Map<String, Object> config) {
        return new ComponentRequest(id, id.toUpperCase(), type, null, config);
    }

    private ConnectionRequest connection(String source, String target) {
        return new ConnectionRequest(null, source, target, null, null, null, null);
    }

    @Test
    @DisplayName("create stores an empty workflow with timestamps")
    void create() {
        Workflow created = service.findById(workflowId);

        assertThat(created.name()).isEqualTo("Flow");
        assertThat(created.description()).isEqualTo("demo");
        assertThat(created.components()).isEmpty();
        assertThat(created.createdAt()).isNotNull();
        assertThat(created.updatedAt()).isEqualTo(created.createdAt());
        assertThat(service.findAll()).singleElement().satisfies(item -> assertThat(item.id()).isEqualTo(workflowId));
    }

    @Test
    @DisplayName("create with a full graph validates it")
    void createWithGraph() {
        WorkflowCreateRequest cyclic = new WorkflowCreateRequest("Cyclic", null, null,
                List.of(component("a", ComponentType.PLUGIN, Map.of(Component.PLUGIN_TYPE, "x")),
                        component("b", ComponentType.PLUGIN, Map.of(Component.PLUGIN_TYPE, "x"))),
                List.of(connection("a", "b"), connection("b", "a")));

        assertThatThrownBy(() -> service.create(cyclic)).isInstanceOf(WorkflowGraphValidationException.class);
        assertThat(store.list()).hasSize(1);
    }

    @Nested
    @DisplayName("editing")
    class Editing {

        @Test
        @DisplayName("adds components with generated ids and connections between them")
        void addComponentsAndConnections() {
            Component input = service.addComponent(workflowId, component("", ComponentType.INPUT, null));
            Component output = service.addComponent(workflowId, component("out", ComponentType.OUTPUT, null));
            Connection connection = service.addConnection(workflowId, connection(input.id(), "out"));

            Workflow workflow = service.findById(workflowId);
            assertThat(input.id()).isNotBlank();
            assertThat(workflow.components()).containsExactly(input, output);
            assertThat(workflow.connections()).containsExactly(connection);
            assertThat(workflow.updatedAt()).isAfterOrEqualTo(workflow.createdAt());
        }

        @Test
        @DisplayName("rejects a connection to an unknown component and keeps the stored workflow")
        void rejectsDanglingConnection() {
            service.addComponent(workflowId, component("in", ComponentType.INPUT, null));

            assertThatThrownBy(() -> service.addConnection(workflowId, connection("in", "ghost")))
                    .isInstanceOf(WorkflowGraphValidationException.class);
            assertThat(service.findById(workflowId).connections()).isEmpty();
        }

        @Test
        @DisplayName("rejects a duplicate component id")
        void rejectsDuplicateComponent() {
            service.addComponent(workflowId, component("in", ComponentType.INPUT, null));

            assertThatThrownBy(() -> service.addComponent(workflowId, component("in", ComponentType.OUTPUT, null)))
                    .isInstanceOf(WorkflowGraphValidationException.class);
        }

        @Test
        @DisplayName("updates name and config of a component, keeping id and type")
        void updatesComponent() {
            service.addComponent(workflowId, component("p", ComponentType.PLUGIN, Map.of(Component.PLUGIN_TYPE, "web_search")));

            Component updated = service.updateComponent(workflowId, "p",
                    new ComponentUpdateRequest("Search", null, Map.of(Component.PLUGIN_TYPE, "other")));

            assertThat(updated.id()).isEqualTo("p");
            assertThat(updated.type()).isEqualTo(ComponentType.PLUGIN);
            assertThat(updated.name()).isEqualTo("Search");
            assertThat(service.findById(workflowId).findComponent("p").orElseThrow().configString(Component.PLUGIN_TYPE))
                    .isEqualTo("other");
        }

        @Test
        @DisplayName("deleting a component removes its connections")
        void deleteComponentCascades() {
            service.addComponent(workflowId, component("in", ComponentType.INPUT, null));
            service.addComponent(workflowId, component("out", ComponentType.OUTPUT, null));
            service.addConnection(workflowId, connection("in", "out"));

            service.deleteComponent(workflowId, "out");

            Workflow workflow = service.findById(workflowId);
            assertThat(workflow.components()).extracting(Component::id).containsExactly("in");
            assertThat(workflow.connections()).isEmpty();
        }

        @Test
        @DisplayName("deletes a connection by id")
        void deleteConnection() {
            service.addComponent(workflowId, component("in", ComponentType.INPUT, null));
            service.addComponent(workflowId, component("out", ComponentType.OUTPUT, null));
            Connection connection = service.addConnection(workflowId, connection("in", "out"));

            service.deleteConnection(workflowId, connection.id());

            assertThat(service.findById(workflowId).connections()).isEmpty();
        }

        @Test
        @DisplayName("unknown component or connection ids raise not-found errors")
        void notFound() {
            assertThatThrownBy(() -> service.updateComponent(workflowId, "nope", new ComponentUpdateRequest("x", null, null)))
                    .isInstanceOf(ComponentNotFoundException.class);
            assertThatThrownBy(() -> service.deleteComponent(workflowId, "nope"))
                    .isInstanceOf(ComponentNotFoundException.class);
            assertThatThrownBy(() -> service.deleteConnection(workflowId, "nope"))
                    .isInstanceOf(ConnectionNotFoundException.class);
        }
    }

    @Test
    @DisplayName("update changes details and, when given, replaces the graph")
    void update() {
        Workflow updated = service.update(workflowId, new WorkflowUpdateRequest("Renamed", null, Map.of("k", "v"),
                List.of(component("in", ComponentType.INPUT, null), component("out", ComponentType.OUTPUT, null)),
                List.of(new ConnectionRequest("c1", "in", "out", null, null, null, Map.of("label", "main")))));

        assertThat(updated.name()).isEqualTo("Renamed");
        assertThat(updated.description()).isEqualTo("demo");
        assertThat(updated.config()).containsEntry("k", "v");
        assertThat(updated.connections()).extracting(Connection::id).containsExactly("c1");
        assertThat(updated.connections().get(0).config()).containsEntry("label", "main");
    }

    @Test
    @DisplayName("import keeps the workflow id and the original creation time")
    void importWorkflow() {
        Workflow first = service.importWorkflow(workflow("example").input("i").build());
        Workflow second = service.importWorkflow(workflow("example").input("i").output("o").build());

        assertThat(second.id()).isEqualTo("example");
        assertThat(second.createdAt()).isEqualTo(first.createdAt());
        assertThat(service.findById("example").components()).hasSize(2);
    }

    @Test
    @DisplayName("delete removes the workflow, and unknown ids raise WorkflowNotFoundException")
    void delete() {
        service.delete(workflowId);

        assertThatThrownBy(() -> service.findById(workflowId)).isInstanceOf(WorkflowNotFoundException.class);
        assertThatThrownBy(() -> service.delete(workflowId)).isInstanceOf(WorkflowNotFoundException.class);
        assertThatThrownBy(() -> service.addComponent(workflowId, component("x", ComponentType.INPUT, null)))
                .isInstanceOf(WorkflowNotFoundException.class);
    }
}
