package com.example.workflowengine.api.v1;

import com.example.workflowengine.api.GlobalExceptionHandler;
import com.example.workflowengine.domain.ComponentType;
import com.example.workflowengine.engine.WorkflowExecutionManager;
import com.example.workflowengine.engine.WorkflowScheduler;
import com.example.workflowengine.executor.ComponentExecutorRegistry;
import com.example.workflowengine.executor.DataSourceExecutor;
import com.example.workflowengine.executor.HandlerRegistry;
import com.example.workflowengine.executor.PassThroughExecutor;
import com.example.workflowengine.executor.PluginExecutor;
import com.example.workflowengine.executor.handler.DocumentSourceHandler;
import com.example.workflowengine.executor.handler.WebSearchHandler;
import com.example.workflowengine.service.WorkflowDefinitionService;
import com.example.workflowengine.service.WorkflowRunService;
import com.example.workflowengine.support.InMemoryWorkflowStore;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("Workflow REST API")
class WorkflowControllerTest {

    private static final JsonMapper JSON = JsonMapper.builder().build();

    private static final String SEARCH_WORKFLOW = """
            {
              "name": "Search workflow",
              "description": "query -> search -> answer",
              "components": [
                { "id": "query", "name": "Query", "type": "input" },
                { "id": "search", "name": "Search", "type": "plugin", "config": { "plugin_type": "web_search" } },
                { "id": "answer", "name": "Answer", "type": "output" }
              ],
              "connections": [
                { "id": "c1", "source_id": "query", "target_id": "search" },
                { "id": "c2", "source_id": "search", "target_id": "answer" }
              ]
            }
            """;

    private ExecutorService workers;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        workers = Executors.newFixedThreadPool(2);
        HandlerRegistry plugins = new HandlerRegistry("plugin").register(WebSearchHandler.NAME, new WebSearchHandler());
        HandlerRegistry dataSources = new HandlerRegistry("data source")
                .register(DocumentSourceHandler.NAME, new DocumentSourceHandler());
        PassThroughExecutor passThrough = new PassThroughExecutor();
        ComponentExecutorRegistry registry = ComponentExecutorRegistry.builder()
                .register(ComponentType.INPUT, passThrough)
                .register(ComponentType.OUTPUT, passThrough)
                .register(ComponentType.PLUGIN, new PluginExecutor(plugins))
                .register(ComponentType.DATA_SOURCE, new DataSourceExecutor(dataSources))
                .build();
        // Background runs execute inline so their final state is observable right away.
        WorkflowExecutionManager manager = new WorkflowExecutionManager(
                new WorkflowScheduler(registry, workers), Runnable::run, 20);
        InMemoryWorkflowStore store = new InMemoryWorkflowStore();
        WorkflowRunService runService = new WorkflowRunService(store, manager);
        mvc = MockMvcBuilders
                .standaloneSetup(
                        new WorkflowController(new WorkflowDefinitionService(store), runService),
                        new ExecutionController(runService),
                        new HandlersController(plugins, dataSources))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private JsonNode body(MvcResult result) throws Exception {
        return JSON.readTree(result.getResponse().getContentAsString());
    }

    private String createSearchWorkflow() throws Exception {
        MvcResult result = mvc.perform(post("/api/v1/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SEARCH_WORKFLOW))
                .andExpect(status().isCreated())
                .andReturn();
        return body(result).get("id").asString();
    }

    @Nested
    @DisplayName("definitions")
    class Definitions {

        @Test
        @DisplayName("POST then GET returns the stored graph")
        void createAndGet() throws Exception {
            String id = createSearchWorkflow();

            mvc.perform(get("/api/v1/workflows/{id}", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.name").value("Search workflow"))
                    .andExpect(jsonPath("$.components", hasSize(3)))
                    .andExpect(jsonPath("$.components[1].type").value("plugin"))
                    .andExpect(jsonPath("$.connections[0].source_id").value("query"))
                    .andExpect(jsonPath("$.created_at").exists());

            mvc.perform(get("/api/v1/workflows"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.workflows", hasSize(1)))
                    .andExpect(jsonPath("$.workflows[0].component_count").value(3))
                    .andExpect(jsonPath("$.workflows[0].connection_count").value(2));
        }

        @Test
        @DisplayName("POST without a name returns 400")
        void missingName() throws Exception {
            mvc.perform(post("/api/v1/workflows")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"description\":\"no name\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Validation failed"));
        }

        @Test
        @DisplayName("POST with a cyclic graph returns 400 with field errors")
        void cyclicGraph() throws Exception {
            String cyclic = """
                    {
                      "name": "Loop",
                      "components": [
                        { "id": "a", "type": "output" },
                        { "id": "b", "type": "output" }
                      ],
                      "connections": [
                        { "source_id": "a", "target_id": "b" },
                        { "source_id": "b", "target_id": "a" }
                      ]
                    }
                    """;

            mvc.perform(post("/api/v1/workflows").contentType(MediaType.APPLICATION_JSON).content(cyclic))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errors[0].field").value("connections"));
        }

        @Test
        @DisplayName("PUT renames and DELETE removes the workflow")
        void updateAndDelete() throws Exception {
            String id = createSearchWorkflow();

            mvc.perform(put("/api/v1/workflows/{id}", id)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"Renamed\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.name").value("Renamed"))
                    .andExpect(jsonPath("$.components", hasSize(3)));

            mvc.perform(delete("/api/v1/workflows/{id}", id)).andExpect(status().isNoContent());
            mvc.perform(get("/api/v1/workflows/{id}", id))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.message").value("Workflow not found: " + id));
        }

        @Test
        @DisplayName("components and connections can be edited individually")
        void editGraph() throws Exception {
            String id = createSearchWorkflow();

            mvc.perform(post("/api/v1/workflows/{id}/components", id)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"id\":\"docs\",\"type\":\"data_source\",\"config\":{\"source_type\":\"document\"}}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.id").value("docs"));
            mvc.perform(post("/api/v1/workflows/{id}/connections", id)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"id\":\"c3\",\"source_id\":\"query\",\"target_id\":\"docs\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.target_id").value("docs"));
            mvc.perform(patch("/api/v1/workflows/{id}/components/{componentId}", id, "docs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"Documents\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.name").value("Documents"));

            mvc.perform(delete("/api/v1/workflows/{id}/connections/{connectionId}", id, "c3"))
                    .andExpect(status().isNoContent());
            mvc.perform(delete("/api/v1/workflows/{id}/components/{componentId}", id, "search"))
                    .andExpect(status().isNoContent());

            mvc.perform(get("/api/v1/workflows/{id}", id))
                    .andExpect(jsonPath("$.components", hasSize(3)))
                    .andExpect(jsonPath("$.connections", hasSize(0)));
            mvc.perform(delete("/api/v1/workflows/{id}/components/{componentId}", id, "search"))
                    .andExpect(status().isNotFound());
        }
    }

    @Nested
    @DisplayName("runs")
    class Runs {

        @Test
        @DisplayName("execute runs the graph and returns results per component")
        void execute() throws Exception {
            String id = createSearchWorkflow();

            MvcResult result = mvc.perform(post("/api/v1/workflows/{id}/execute", id)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"inputs\":{\"query\":\"java\"}}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("completed"))
                    .andExpect(jsonPath("$.workflow_id").value(id))
                    .andExpect(jsonPath("$.results.query.query").value("java"))
                    .andExpect(jsonPath("$.results.answer.results", hasSize(2)))
                    .andExpect(jsonPath("$.logs", hasSize(3)))
                    .andReturn();
            String executionId = body(result).get("id").asString();

            mvc.perform(get("/api/v1/executions/{id}", executionId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("completed"));
            mvc.perform(get("/api/v1/executions").param("workflowId", id))
                    .andExpect(jsonPath("$.executions", hasSize(1)));
            mvc.perform(post("/api/v1/executions/{id}/cancel", executionId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.cancelled").value(false));
        }

        @Test
        @DisplayName("a failing component is reported and its dependents are unreached")
        void failingComponent() throws Exception {
            String id = createSearchWorkflow();

            mvc.perform(post("/api/v1/workflows/{id}/execute", id)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"inputs\":{}}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("failed"))
                    .andExpect(jsonPath("$.errors.search").value("No query provided"))
                    .andExpect(jsonPath("$.unreached[0]").value("answer"));
        }

        @Test
        @DisplayName("a background run is accepted with 202")
        void start() throws Exception {
            String id = createSearchWorkflow();

            MvcResult result = mvc.perform(post("/api/v1/workflows/{id}/executions", id)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"inputs\":{\"query\":\"java\"}}"))
                    .andExpect(status().isAccepted())
                    .andReturn();
            String executionId = body(result).get("id").asString();

            mvc.perform(get("/api/v1/executions/{id}", executionId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("completed"));
            assertThat(executionId).isNotBlank();
        }

        @Test
        @DisplayName("unknown workflows and executions return 404")
        void notFound() throws Exception {
            mvc.perform(post("/api/v1/workflows/{id}/execute", "missing")).andExpect(status().isNotFound());
            mvc.perform(get("/api/v1/executions/{id}", "missing")).andExpect(status().isNotFound());
            mvc.perform(post("/api/v1/executions/{id}/cancel", "missing")).andExpect(status().isNotFound());
        }
    }

    @Test
    @DisplayName("GET /handlers lists registered plugin and data source names")
    void handlers() throws Exception {
        mvc.perform(get("/api/v1/handlers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plugins[0]").value("web_search"))
                .andExpect(jsonPath("$.data_sources[0]").value("document"));
    }
}
