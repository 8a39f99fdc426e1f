package com.example.workflowengine.api.v1;

import com.example.workflowengine.api.v1.dto.HandlerListResponse;
import com.example.workflowengine.executor.HandlerRegistry;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller listing the plugin and data-source handlers components may name.
 */
@RestController
@RequestMapping("/api/v1/handlers")
@Slf4j
public class HandlersController {

    private final HandlerRegistry pluginHandlers;
    private final HandlerRegistry dataSourceHandlers;

    public HandlersController(@Qualifier("pluginHandlers") HandlerRegistry pluginHandlers,
                              @Qualifier("dataSourceHandlers") HandlerRegistry dataSourceHandlers) {
        this.pluginHandlers = pluginHandlers;
        this.dataSourceHandlers = dataSourceHandlers;
    }

    @GetMapping
    public HandlerListResponse list() {
        HandlerListResponse response = new HandlerListResponse(
                pluginHandlers.availableNames(), dataSourceHandlers.availableNames());
        log.debug("Listing handlers plugins={} dataSources={}", response.plugins().size(), response.dataSources().size());
        return response;
    }
}
