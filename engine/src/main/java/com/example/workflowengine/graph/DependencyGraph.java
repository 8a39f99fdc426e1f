package com.example.workflowengine.graph;

import com.example.workflowengine.domain.Component;
import com.example.workflowengine.domain.ComponentType;
import com.example.workflowengine.domain.Connection;
import com.example.workflowengine.domain.Workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dependency and dependent sets of every component, derived from a workflow's connections.
 * <p>
 * A connection's source is a dependency of its target. Iteration orders are stable: dependencies
 * and dependents follow connection declaration order, {@link #initiallyReady()} follows component
 * declaration order. Connections whose endpoints are not components of the workflow are left out.
 * </p>
 */
public final class DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    private final Set<String> componentIds;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;
    private final Set<String> initiallyReady;

    private DependencyGraph(Set<String> componentIds,
                            Map<String, Set<String>> dependencies,
                            Map<String, Set<String>> dependents,
                            Set<String> initiallyReady) {
        this.componentIds = componentIds;
        this.dependencies = dependencies;
        this.dependents = dependents;
        this.initiallyReady = initiallyReady;
    }

    /**
     * Builds the graph. Components without dependencies are initially ready, and so is every input
     * component whatever its dependencies, since inputs receive the caller's data directly.
     */
    public static DependencyGraph resolve(Workflow workflow) {
        Set<String> ids = new LinkedHashSet<>();
        for (Component component : workflow.components()) {
            ids.add(component.id());
        }
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        Map<String, Set<String>> dependents = new LinkedHashMap<>();
        for (Connection connection : workflow.connections()) {
            if (!ids.contains(connection.sourceId()) || !ids.contains(connection.targetId())) {
                log.warn("Ignoring connection id={} with unknown endpoint source={} target={} workflowId={}",
                        connection.id(), connection.sourceId(), connection.targetId(), workflow.id());
                continue;
            }
            dependents.computeIfAbsent(connection.sourceId(), k -> new LinkedHashSet<>()).add(connection.targetId());
            dependencies.computeIfAbsent(connection.targetId(), k -> new LinkedHashSet<>()).add(connection.sourceId());
        }
        Set<String> ready = new LinkedHashSet<>();
        for (Component component : workflow.components()) {
            if (!dependencies.containsKey(component.id()) || component.type() == ComponentType.INPUT) {
                ready.add(component.id());
            }
        }
        return new DependencyGraph(
                Collections.unmodifiableSet(ids),
                freeze(dependencies),
                freeze(dependents),
                Collections.unmodifiableSet(ready)
        );
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> source) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(v)));
        return Collections.unmodifiableMap(copy);
    }

    public Set<String> componentIds() {
        return componentIds;
    }

    public Set<String> dependencies(String componentId) {
        return dependencies.getOrDefault(componentId, Set.of());
    }

    public Set<String> dependents(String componentId) {
        return dependents.getOrDefault(componentId, Set.of());
    }

    public Set<String> initiallyReady() {
        return initiallyReady;
    }

    /**
     * True when every dependency of {@code componentId} is in {@code completed}.
     */
    public boolean isSatisfied(String componentId, Collection<String> completed) {
        return completed.containsAll(dependencies(componentId));
    }

    /**
     * Finds one cycle, returned as the path of component ids that closes on its first element
     * (e.g. {@code [a, b, c, a]}). The walk keeps its own stack, so long chains are fine.
     */
    public Optional<List<String>> findCycle() {
        Map<String, Mark> marks = new HashMap<>();
        for (String root : componentIds) {
            if (marks.containsKey(root)) {
                continue;
            }
            List<String> path = new ArrayList<>();
            Deque<Iterator<String>> pending = new ArrayDeque<>();
            marks.put(root, Mark.IN_PROGRESS);
            path.add(root);
            pending.push(dependents(root).iterator());
            while (!pending.isEmpty()) {
                Iterator<String> it = pending.peek();
                if (!it.hasNext()) {
                    pending.pop();
                    marks.put(path.remove(path.size() - 1), Mark.DONE);
                    continue;
                }
                String next = it.next();
                Mark mark = marks.get(next);
                if (mark == Mark.IN_PROGRESS) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    cycle.add(next);
                    return Optional.of(List.copyOf(cycle));
                }
                if (mark == null) {
                    marks.put(next, Mark.IN_PROGRESS);
                    path.add(next);
                    pending.push(dependents(next).iterator());
                }
            }
        }
        return Optional.empty();
    }

    private enum Mark {
        IN_PROGRESS,
        DONE
    }
}
