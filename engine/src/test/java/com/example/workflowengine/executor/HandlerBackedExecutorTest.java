package com.example.workflowengine.executor;

import com.example.workflowengine.domain.Component;
import com.example.workflowengine.domain.ComponentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Plugin and data-source executors")
class HandlerBackedExecutorTest {

    private final HandlerRegistry plugins = new HandlerRegistry("plugin")
            .register("upper", (component, inputs, context) -> Map.of("text", inputs.get("text").toString().toUpperCase()))
            .register("broken", (component, inputs, context) -> {
                throw new IllegalStateException("disk full");
            })
            .register("silent", (component, inputs, context) -> null);
    private final PluginExecutor pluginExecutor = new PluginExecutor(plugins);

    private static Component plugin(Map<String, Object> config) {
        return Component.of("p", "Plugin", ComponentType.PLUGIN, config);
    }

    @Test
    @DisplayName("runs the handler named by plugin_type")
    void runsNamedHandler() {
        Map<String, Object> output = pluginExecutor.execute(plugin(Map.of(Component.PLUGIN_TYPE, "upper")), Map.of("text", "abc"), Map.of());

        assertThat(output).containsExactlyEntriesOf(Map.of("text", "ABC"));
    }

    @Test
    @DisplayName("missing plugin_type is a component-level error")
    void missingType() {
        Map<String, Object> output = pluginExecutor.execute(plugin(Map.of()), Map.of(), Map.of());

        assertThat(ComponentErrors.message(output)).isEqualTo("No plugin_type configured");
    }

    @Test
    @DisplayName("unknown plugin_type is a component-level error")
    void unknownType() {
        Map<String, Object> output = pluginExecutor.execute(plugin(Map.of(Component.PLUGIN_TYPE, "nope")), Map.of(), Map.of());

        assertThat(ComponentErrors.message(output)).isEqualTo("Unknown plugin type: nope");
    }

    @Test
    @DisplayName("a throwing handler becomes an error payload")
    void handlerFailure() {
        Map<String, Object> output = pluginExecutor.execute(plugin(Map.of(Component.PLUGIN_TYPE, "broken")), Map.of(), Map.of());

        assertThat(ComponentErrors.message(output)).isEqualTo("Error executing plugin: disk full");
    }

    @Test
    @DisplayName("a null handler result becomes an empty output")
    void nullResult() {
        Map<String, Object> output = pluginExecutor.execute(plugin(Map.of(Component.PLUGIN_TYPE, "silent")), Map.of(), Map.of());

        assertThat(output).isEmpty();
    }

    @Test
    @DisplayName("data-source executor resolves source_type")
    void dataSourceUsesSourceType() {
        HandlerRegistry sources = new HandlerRegistry("data source")
                .register("fixed", (component, inputs, context) -> Map.of("rows", 2));
        DataSourceExecutor executor = new DataSourceExecutor(sources);
        Component source = Component.of("d", "Source", ComponentType.DATA_SOURCE, Map.of(Component.SOURCE_TYPE, "fixed"));

        assertThat(executor.execute(source, Map.of(), Map.of())).containsEntry("rows", 2);
        assertThat(ComponentErrors.message(executor.execute(source.withConfig(Map.of(Component.SOURCE_TYPE, "other")), Map.of(), Map.of())))
                .isEqualTo("Unknown data source type: other");
        assertThat(ComponentErrors.message(executor.execute(source.withConfig(Map.of()), Map.of(), Map.of())))
                .isEqualTo("No source_type configured");
    }

    @Test
    @DisplayName("pass-through executor copies its inputs")
    void passThrough() {
        Component output = Component.of("o", "Out", ComponentType.OUTPUT, null);

        assertThat(new PassThroughExecutor().execute(output, Map.of("k", "v"), Map.of())).containsExactlyEntriesOf(Map.of("k", "v"));
    }
}
