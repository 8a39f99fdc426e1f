package com.example.workflowengine.config;

import com.example.workflowengine.agent.AgentServiceClient;
import com.example.workflowengine.domain.ComponentType;
import com.example.workflowengine.engine.WorkflowExecutionManager;
import com.example.workflowengine.engine.WorkflowScheduler;
import com.example.workflowengine.executor.AgentExecutor;
import com.example.workflowengine.executor.ComponentExecutorRegistry;
import com.example.workflowengine.executor.DataSourceExecutor;
import com.example.workflowengine.executor.HandlerRegistry;
import com.example.workflowengine.executor.PassThroughExecutor;
import com.example.workflowengine.executor.PluginExecutor;
import com.example.workflowengine.executor.handler.DocumentSourceHandler;
import com.example.workflowengine.executor.handler.WebSearchHandler;
import com.example.workflowengine.llm.ChatModelFactory;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the engine: handler registries, component executors, worker pool, scheduler and execution manager.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    public HandlerRegistry pluginHandlers() {
        return new HandlerRegistry("plugin")
                .register(WebSearchHandler.NAME, new WebSearchHandler());
    }

    @Bean
    public HandlerRegistry dataSourceHandlers() {
        return new HandlerRegistry("data source")
                .register(DocumentSourceHandler.NAME, new DocumentSourceHandler());
    }

    @Bean
    public AgentServiceClient agentServiceClient(@Value("${engine.agent-service.timeout:30s}") Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return new AgentServiceClient(RestClient.builder().requestFactory(requestFactory).build());
    }

    @Bean
    public ComponentExecutorRegistry componentExecutorRegistry(
            AgentServiceClient agentServiceClient,
            ChatModelFactory chatModelFactory,
            @Qualifier("pluginHandlers") HandlerRegistry pluginHandlers,
            @Qualifier("dataSourceHandlers") HandlerRegistry dataSourceHandlers,
            @Value("${engine.agent-service.base-url:http://localhost:5000/api}") String agentServiceUrl) {
        PassThroughExecutor passThrough = new PassThroughExecutor();
        return ComponentExecutorRegistry.builder()
                .register(ComponentType.INPUT, passThrough)
                .register(ComponentType.OUTPUT, passThrough)
                .register(ComponentType.AGENT, new AgentExecutor(agentServiceClient, chatModelFactory, agentServiceUrl))
                .register(ComponentType.PLUGIN, new PluginExecutor(pluginHandlers))
                .register(ComponentType.DATA_SOURCE, new DataSourceExecutor(dataSourceHandlers))
                .build()
                .requireComplete();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService workflowWorkerPool(@Value("${engine.worker-pool-size:4}") int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("engine.worker-pool-size must be at least 1, was " + poolSize);
        }
        return Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("workflow-worker-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService workflowRunExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("workflow-run-"));
    }

    @Bean
    public WorkflowScheduler workflowScheduler(ComponentExecutorRegistry componentExecutorRegistry,
                                               @Qualifier("workflowWorkerPool") ExecutorService workerPool) {
        return new WorkflowScheduler(componentExecutorRegistry, workerPool);
    }

    @Bean
    public WorkflowExecutionManager workflowExecutionManager(
            WorkflowScheduler workflowScheduler,
            @Qualifier("workflowRunExecutor") ExecutorService runExecutor,
            @Value("${engine.history-limit:500}") int historyLimit) {
        return new WorkflowExecutionManager(workflowScheduler, runExecutor, historyLimit);
    }
}
