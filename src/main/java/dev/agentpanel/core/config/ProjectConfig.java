package dev.agentpanel.core.config;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One {@code [[project]]} entry after validation.
 *
 * @param id normalized identifier derived from {@code name}, never empty
 * @param name display name
 * @param remote VS Code Remote-SSH authority; when present {@code path} is a remote absolute path
 * @param path absolute project path
 * @param color {@code #RRGGBB} or a lowercase palette name
 * @param useAgentLayer whether the project launches through the agent layer
 * @param chromePinnedTabs per-project always-open tabs
 * @param chromeDefaultTabs per-project tabs used when no tab history exists
 */
public record ProjectConfig(
    String id,
    String name,
    Optional<String> remote,
    String path,
    String color,
    boolean useAgentLayer,
    List<String> chromePinnedTabs,
    List<String> chromeDefaultTabs
) {
    public ProjectConfig {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(color, "color");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Project id must not be empty");
        }
        chromePinnedTabs = List.copyOf(chromePinnedTabs);
        chromeDefaultTabs = List.copyOf(chromeDefaultTabs);
    }

    /**
     * Local project with no tab overrides.
     */
    public static ProjectConfig local(String id, String name, String path, String color) {
        return new ProjectConfig(id, name, Optional.empty(), path, color, false, List.of(), List.of());
    }

    public boolean isSsh() {
        return remote.isPresent();
    }
}
