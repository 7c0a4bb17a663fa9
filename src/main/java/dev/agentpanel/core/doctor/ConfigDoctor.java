package dev.agentpanel.core.doctor;

import dev.agentpanel.core.config.ConfigError;
import dev.agentpanel.core.config.ConfigFinding;
import dev.agentpanel.core.config.ConfigLoadResult;
import dev.agentpanel.core.config.ConfigLoader;
import dev.agentpanel.core.config.ProjectConfig;
import dev.agentpanel.core.fs.FileSystem;
import dev.agentpanel.core.remote.RemoteAuthority;
import dev.agentpanel.core.shared.Result;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration part of the self-diagnostics report.
 */
public final class ConfigDoctor {
    private ConfigDoctor() {}

    /**
     * Findings in check order; wrap them in a {@link DoctorReport} for display.
     */
    public static List<ConfigFinding> check(Path configPath, FileSystem fileSystem) {
        List<ConfigFinding> findings = new ArrayList<>();
        Result<ConfigLoadResult, ConfigError> loaded = ConfigLoader.load(configPath, fileSystem);
        if (loaded.isErr()) {
            findings.add(ConfigFinding.fail("Config file error", loaded.error().message(), null));
            return findings;
        }

        ConfigLoadResult result = loaded.value();
        if (result.config().isPresent()) {
            findings.add(ConfigFinding.pass("Config file parsed successfully", configPath.toString()));
        }
        findings.addAll(result.findings());

        for (ProjectConfig project : result.projects()) {
            if (project.isSsh()) {
                // Remote paths live on another host; report the command that checks them instead.
                String target = project.remote().flatMap(RemoteAuthority::extractTarget).orElseThrow();
                findings.add(ConfigFinding.pass(
                    "Remote project: " + project.id(),
                    "Check with: ssh " + target + " test -d " + RemoteAuthority.shellEscape(project.path())
                ));
                continue;
            }
            if (fileSystem.exists(Path.of(project.path()))) {
                findings.add(ConfigFinding.pass("Project path exists: " + project.id(), project.path()));
            } else {
                findings.add(ConfigFinding.warn(
                    "Project path not found: " + project.id(),
                    project.path(),
                    "Create the directory or update path for this project in config.toml."
                ));
            }
        }
        return findings;
    }
}
