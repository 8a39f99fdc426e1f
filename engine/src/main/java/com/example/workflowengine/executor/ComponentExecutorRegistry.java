package com.example.workflowengine.executor;

import com.example.workflowengine.domain.ComponentType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Dispatch table from component type to executor. Built once at start-up and handed to the scheduler.
 */
public final class ComponentExecutorRegistry {

    private final Map<ComponentType, ComponentExecutor> executors;

    private ComponentExecutorRegistry(Map<ComponentType, ComponentExecutor> executors) {
        this.executors = Collections.unmodifiableMap(executors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ComponentExecutor> executorFor(ComponentType type) {
        return Optional.ofNullable(executors.get(type));
    }

    public Set<ComponentType> registeredTypes() {
        return executors.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(executors.keySet()));
    }

    /**
     * Fails when some component type has no executor.
     */
    public ComponentExecutorRegistry requireComplete() {
        Set<ComponentType> missing = EnumSet.allOf(ComponentType.class);
        missing.removeAll(executors.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No executor registered for component types: " + missing);
        }
        return this;
    }

    public static final class Builder {

        private final Map<ComponentType, ComponentExecutor> executors = new EnumMap<>(ComponentType.class);

        private Builder() {
        }

        public Builder register(ComponentType type, ComponentExecutor executor) {
            executors.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(executor, "executor"));
            return this;
        }

        public ComponentExecutorRegistry build() {
            return new ComponentExecutorRegistry(new EnumMap<>(executors));
        }
    }
}
