package dev.agentpanel.core.config;

import java.util.List;

/**
 * {@code [chrome]} section.
 *
 * @param pinnedTabs URLs always opened as leftmost tabs in a fresh browser window
 * @param defaultTabs URLs opened when a project has no saved tab history
 * @param openGitRemote add the project's git remote URL as an always-open tab
 */
public record ChromeConfig(List<String> pinnedTabs, List<String> defaultTabs, boolean openGitRemote) {
    private static final ChromeConfig DEFAULTS = new ChromeConfig(List.of(), List.of(), false);

    public ChromeConfig {
        pinnedTabs = List.copyOf(pinnedTabs);
        defaultTabs = List.copyOf(defaultTabs);
    }

    public static ChromeConfig defaults() {
        return DEFAULTS;
    }
}
