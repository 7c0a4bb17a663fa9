package dev.agentpanel.core.config;

import java.util.List;
import java.util.Objects;

/**
 * Fully parsed AgentPanel configuration. Projects keep their declaration order.
 */
public record Config(
    AppConfig app,
    AgentLayerConfig agentLayer,
    ChromeConfig chrome,
    LayoutConfig layout,
    List<ProjectConfig> projects
) {
    public Config {
        Objects.requireNonNull(app, "app");
        Objects.requireNonNull(agentLayer, "agentLayer");
        Objects.requireNonNull(chrome, "chrome");
        Objects.requireNonNull(layout, "layout");
        projects = List.copyOf(projects);
    }
}
