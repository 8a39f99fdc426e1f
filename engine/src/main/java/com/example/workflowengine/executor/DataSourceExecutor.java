package com.example.workflowengine.executor;

import com.example.workflowengine.domain.Component;

/**
 * Runs the data-source handler named by the component's {@code source_type}.
 */
public class DataSourceExecutor extends HandlerBackedExecutor {

    public DataSourceExecutor(HandlerRegistry dataSources) {
        super(dataSources, Component.SOURCE_TYPE, "data source");
    }
}
