package com.example.workflowengine.executor;

import com.example.workflowengine.domain.Component;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Executor that delegates to a named handler looked up by a config key of the component.
 */
@Slf4j
public abstract class HandlerBackedExecutor implements ComponentExecutor {

    private final HandlerRegistry handlers;
    private final String typeKey;
    private final String label;

    protected HandlerBackedExecutor(HandlerRegistry handlers, String typeKey, String label) {
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.typeKey = Objects.requireNonNull(typeKey, "typeKey");
        this.label = Objects.requireNonNull(label, "label");
    }

    @Override
    public Map<String, Object> execute(Component component, Map<String, Object> inputs, Map<String, Object> context) {
        String name = component.configString(typeKey);
        if (name == null) {
            log.warn("Component id={} has no {}", component.id(), typeKey);
            return ComponentErrors.error("No " + typeKey + " configured");
        }
        Optional<ComponentHandler> handler = handlers.find(name);
        if (handler.isEmpty()) {
            log.warn("Unknown {} type={} componentId={} available={}", label, name, component.id(), handlers.availableNames());
            return ComponentErrors.error("Unknown " + label + " type: " + name);
        }
        log.debug("Running {} handler={} componentId={}", label, name, component.id());
        try {
            Map<String, Object> output = handler.get().handle(component, inputs, context);
            return output != null ? output : new LinkedHashMap<>();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ComponentErrors.error("Error executing " + label + ": interrupted");
        } catch (Exception e) {
            log.error("Error executing {} handler={} componentId={}: {}", label, name, component.id(), e.getMessage(), e);
            return ComponentErrors.error("Error executing " + label + ": " + e.getMessage());
        }
    }
}
