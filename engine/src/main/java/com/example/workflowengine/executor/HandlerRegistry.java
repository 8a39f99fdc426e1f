package com.example.workflowengine.executor;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of handlers by name (e.g. {@code web_search}). Used by plugin and data-source executors
 * to resolve the {@code plugin_type} / {@code source_type} of a component. Unlike component types,
 * handler names are an open set and may be registered at any time.
 */
@Slf4j
public class HandlerRegistry {

    private final String kind;
    private final Map<String, ComponentHandler> handlers = new ConcurrentHashMap<>();

    public HandlerRegistry(String kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public HandlerRegistry register(String name, ComponentHandler handler) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        ComponentHandler previous = handlers.put(name, handler);
        if (previous != null) {
            log.info("Replaced {} handler name={}", kind, name);
        } else {
            log.debug("Registered {} handler name={}", kind, name);
        }
        return this;
    }

    public Optional<ComponentHandler> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(name));
    }

    /**
     * Returns the registered handler names, sorted.
     */
    public List<String> availableNames() {
        return handlers.keySet().stream().sorted().toList();
    }

    public String kind() {
        return kind;
    }
}
