package com.example.workflowengine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Registered handler names usable as {@code plugin_type} and {@code source_type}.
 */
public record HandlerListResponse(
        List<String> plugins,
        @JsonProperty("data_sources") List<String> dataSources
) {}
