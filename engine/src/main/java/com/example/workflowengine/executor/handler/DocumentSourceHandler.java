package com.example.workflowengine.executor.handler;

import com.example.workflowengine.domain.Component;
import com.example.workflowengine.executor.ComponentErrors;
import com.example.workflowengine.executor.ComponentHandler;

import java.util.List;
import java.util.Map;

/**
 * Sample {@code document} data source: returns two canned documents mentioning {@code inputs.query}.
 */
public class DocumentSourceHandler implements ComponentHandler {

    public static final String NAME = "document";

    @Override
    public Map<String, Object> handle(Component component, Map<String, Object> inputs, Map<String, Object> context) {
        Object query = inputs.get("query");
        if (query == null || query.toString().isBlank()) {
            return ComponentErrors.error("No query provided");
        }
        String q = query.toString().trim();
        return Map.of("documents", List.of(
                Map.of("title", "Document 1",
                        "content", "This document contains information about " + q),
                Map.of("title", "Document 2",
                        "content", "More information about " + q + " in this document")
        ));
    }
}
