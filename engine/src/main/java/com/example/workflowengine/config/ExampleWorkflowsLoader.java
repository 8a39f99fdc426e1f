package com.example.workflowengine.config;

import com.example.workflowengine.domain.Workflow;
import com.example.workflowengine.service.WorkflowDefinitionService;
import com.example.workflowengine.validation.WorkflowGraphValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads example workflows from {@code classpath:examples/*.json} at startup.
 * Workflows are stored under their own ids, so existing examples are updated in place.
 */
@Component
@ConditionalOnProperty(name = "engine.examples.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ExampleWorkflowsLoader implements ApplicationRunner {

    static final String EXAMPLES_PATTERN = "classpath:examples/*.json";

    private final WorkflowDefinitionService service;
    private final JsonMapper jsonMapper;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        Resource[] resources = new PathMatchingResourcePatternResolver().getResources(EXAMPLES_PATTERN);
        for (Resource resource : resources) {
            loadExample(resource);
        }
    }

    private void loadExample(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            Workflow workflow = service.importWorkflow(jsonMapper.readValue(in, Workflow.class));
            log.info("Loaded example workflow id={} name={}", workflow.id(), workflow.name());
        } catch (JacksonException e) {
            log.error("Failed to parse example workflow {}: {}", resource.getFilename(), e.getMessage());
        } catch (WorkflowGraphValidationException e) {
            log.error("Invalid example workflow {}: {}", resource.getFilename(), e.getErrors());
        } catch (IOException e) {
            log.error("Failed to read example workflow {}: {}", resource.getFilename(), e.getMessage());
        }
    }
}
