package dev.agentpanel.core.config;

/**
 * {@code [agentLayer]} section.
 *
 * @param enabled default {@code useAgentLayer} for projects that do not set it
 */
public record AgentLayerConfig(boolean enabled) {
    private static final AgentLayerConfig DEFAULTS = new AgentLayerConfig(false);

    public static AgentLayerConfig defaults() {
        return DEFAULTS;
    }
}
