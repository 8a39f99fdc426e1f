package com.example.workflowengine.executor;

import com.example.workflowengine.domain.Component;

/**
 * Runs the plugin handler named by the component's {@code plugin_type}.
 */
public class PluginExecutor extends HandlerBackedExecutor {

    public PluginExecutor(HandlerRegistry plugins) {
        super(plugins, Component.PLUGIN_TYPE, "plugin");
    }
}
