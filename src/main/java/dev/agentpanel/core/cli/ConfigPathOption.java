package dev.agentpanel.core.cli;

import dev.agentpanel.core.config.DataPaths;
import java.nio.file.Path;
import picocli.CommandLine;

/**
 * Shared {@code --config} option; defaults to {@code ~/.config/agent-panel/config.toml}.
 */
final class ConfigPathOption {
    @CommandLine.Option(
        names = {"-c", "--config"},
        paramLabel = "PATH",
        description = "Config file path (default: ~/.config/agent-panel/config.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configPath;

    Path resolve() {
        if (configPath != null) {
            return configPath.toAbsolutePath().normalize();
        }
        return DataPaths.forCurrentUser().configFile();
    }
}
