package com.example.workflowengine.executor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds and recognises component-level error payloads: {@code {"error": message, "details": ...}}.
 */
public final class ComponentErrors {

    public static final String ERROR = "error";
    public static final String DETAILS = "details";

    private ComponentErrors() {
    }

    public static Map<String, Object> error(String message) {
        return error(message, null);
    }

    public static Map<String, Object> error(String message, Object details) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(ERROR, message);
        if (details != null) {
            payload.put(DETAILS, details);
        }
        return payload;
    }

    public static boolean isError(Map<String, ?> output) {
        return output != null && output.get(ERROR) != null;
    }

    public static String message(Map<String, ?> output) {
        Object error = output != null ? output.get(ERROR) : null;
        return error != null ? error.toString() : null;
    }
}
