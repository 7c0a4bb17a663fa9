package dev.agentpanel.core.config;

/**
 * {@code [app]} section.
 *
 * @param autoStartAtLogin launch AgentPanel at login
 */
public record AppConfig(boolean autoStartAtLogin) {
    private static final AppConfig DEFAULTS = new AppConfig(false);

    public static AppConfig defaults() {
        return DEFAULTS;
    }
}
