package com.example.workflowengine.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A typed node of a workflow graph.
 * <p>
 * Type-specific settings live in {@code config}; the keys read by the built-in executors are
 * exposed as constants. {@code id} and {@code type} are the component's identity and never change;
 * the {@code with*} methods return edited copies.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Component(
        String id,
        String name,
        ComponentType type,
        String description,
        Map<String, Object> config
) {

    public static final String AGENT_ID = "agent_id";
    public static final String API_URL = "api_url";
    public static final String API_KEY = "api_key";
    public static final String MODEL = "model";
    public static final String SYSTEM_PROMPT = "system_prompt";
    public static final String TEMPERATURE = "temperature";
    public static final String MAX_TOKENS = "max_tokens";
    public static final String PLUGIN_TYPE = "plugin_type";
    public static final String SOURCE_TYPE = "source_type";

    public Component {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public static Component of(String id, String name, ComponentType type, Map<String, Object> config) {
        return new Component(id, name, type, null, config);
    }

    /**
     * Returns the trimmed config value for {@code key}, or null when absent or blank.
     */
    public String configString(String key) {
        Object value = config.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    public Component withName(String newName) {
        return new Component(id, newName, type, description, config);
    }

    public Component withDescription(String newDescription) {
        return new Component(id, name, type, newDescription, config);
    }

    public Component withConfig(Map<String, Object> newConfig) {
        return new Component(id, name, type, description, newConfig);
    }
}
