package com.example.workflowengine.executor.handler;

import com.example.workflowengine.domain.Component;
import com.example.workflowengine.executor.ComponentErrors;
import com.example.workflowengine.executor.ComponentHandler;

import java.util.List;
import java.util.Map;

/**
 * Sample {@code web_search} plugin: returns two canned results for {@code inputs.query}.
 */
public class WebSearchHandler implements ComponentHandler {

    public static final String NAME = "web_search";

    @Override
    public Map<String, Object> handle(Component component, Map<String, Object> inputs, Map<String, Object> context) {
        Object query = inputs.get("query");
        if (query == null || query.toString().isBlank()) {
            return ComponentErrors.error("No query provided");
        }
        String q = query.toString().trim();
        return Map.of("results", List.of(
                Map.of("title", "Result for " + q + " 1",
                        "url", "https://example.com/1",
                        "snippet", "This is a result for " + q),
                Map.of("title", "Result for " + q + " 2",
                        "url", "https://example.com/2",
                        "snippet", "Another result for " + q)
        ));
    }
}
