package com.example.workflowengine.executor;

import com.example.workflowengine.domain.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executor for input and output components: returns its inputs unchanged.
 */
public class PassThroughExecutor implements ComponentExecutor {

    @Override
    public Map<String, Object> execute(Component component, Map<String, Object> inputs, Map<String, Object> context) {
        return inputs != null ? new LinkedHashMap<>(inputs) : new LinkedHashMap<>();
    }
}
