package dev.agentpanel.core.config;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing a configuration text.
 *
 * <p>{@code config} is empty exactly when the text is not valid TOML; {@code findings} must be
 * surfaced in every case. {@code projects} holds the entries that passed validation.
 */
public record ConfigLoadResult(
    Optional<Config> config,
    List<ConfigFinding> findings,
    List<ProjectConfig> projects,
    boolean hasParseError
) {
    public ConfigLoadResult {
        Objects.requireNonNull(config, "config");
        findings = List.copyOf(findings);
        projects = List.copyOf(projects);
        if (hasParseError && config.isPresent()) {
            throw new IllegalArgumentException("A parse error result cannot carry a config");
        }
    }

    public static ConfigLoadResult parsed(Config config, List<ConfigFinding> findings) {
        return new ConfigLoadResult(Optional.of(config), findings, config.projects(), false);
    }

    public static ConfigLoadResult parseError(ConfigFinding finding) {
        return new ConfigLoadResult(Optional.empty(), List.of(finding), List.of(), true);
    }

    public List<ConfigFinding> failures() {
        return findings.stream().filter(ConfigFinding::isFailure).toList();
    }

    public boolean hasFailures() {
        return findings.stream().anyMatch(ConfigFinding::isFailure);
    }
}
