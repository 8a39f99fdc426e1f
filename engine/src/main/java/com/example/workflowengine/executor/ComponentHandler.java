package com.example.workflowengine.executor;

import com.example.workflowengine.domain.Component;

import java.util.Map;

/**
 * Named in-process handler behind a plugin or data-source component.
 */
@FunctionalInterface
public interface ComponentHandler {

    Map<String, Object> handle(Component component, Map<String, Object> inputs, Map<String, Object> context) throws Exception;
}
