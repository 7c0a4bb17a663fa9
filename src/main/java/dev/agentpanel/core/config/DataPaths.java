package dev.agentpanel.core.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Canonical AgentPanel paths derived from a home directory. Performs no I/O.
 */
public record DataPaths(Path homeDirectory) {
    public DataPaths {
        Objects.requireNonNull(homeDirectory, "homeDirectory");
        homeDirectory = homeDirectory.toAbsolutePath().normalize();
    }

    public static DataPaths forCurrentUser() {
        return new DataPaths(Path.of(System.getProperty("user.home")));
    }

    /**
     * {@code ~/.config/agent-panel}
     */
    public Path configDirectory() {
        return homeDirectory.resolve(".config").resolve("agent-panel");
    }

    /**
     * {@code ~/.config/agent-panel/config.toml}
     */
    public Path configFile() {
        return configDirectory().resolve("config.toml");
    }
}
