package com.example.workflowengine.executor;

import com.example.workflowengine.domain.Component;

import java.util.Map;

/**
 * Behaviour bound to a {@link com.example.workflowengine.domain.ComponentType}.
 * <p>
 * Implementations report their own failures (missing config, unknown handler, collaborator
 * errors) as a payload built by {@link ComponentErrors} instead of throwing.
 * </p>
 */
@FunctionalInterface
public interface ComponentExecutor {

    Map<String, Object> execute(Component component, Map<String, Object> inputs, Map<String, Object> context);
}
