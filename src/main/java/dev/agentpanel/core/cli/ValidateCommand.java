package dev.agentpanel.core.cli;

import dev.agentpanel.core.api.ApCoreError;
import dev.agentpanel.core.api.ApCoreException;
import dev.agentpanel.core.config.ConfigError;
import dev.agentpanel.core.config.ConfigLoadResult;
import dev.agentpanel.core.config.ConfigLoader;
import dev.agentpanel.core.doctor.DoctorReport;
import dev.agentpanel.core.fs.DefaultFileSystem;
import dev.agentpanel.core.fs.FileSystem;
import dev.agentpanel.core.shared.Result;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

/**
 * Parses an existing config and prints its findings. Unlike {@code init}, never writes a starter file.
 */
@CommandLine.Command(
    name = "validate",
    description = "Parse config.toml and report findings (exit 1 on any FAIL).",
    mixinStandardHelpOptions = true,
    versionProvider = ApCommand.Version.class
)
final class ValidateCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ConfigPathOption config = new ConfigPathOption();

    @CommandLine.Option(names = "--json", description = "Print findings as JSON.")
    private boolean json;

    @Override
    public Integer call() {
        Path path = config.resolve();
        FileSystem fileSystem = new DefaultFileSystem();
        if (!fileSystem.exists(path)) {
            throw new ApCoreException(ApCoreError.configuration("Config file not found", path.toString()));
        }
        Result<ConfigLoadResult, ConfigError> loaded = ConfigLoader.load(path, fileSystem);
        if (loaded.isErr()) {
            throw new ApCoreException(loaded.error().toApCoreError());
        }
        DoctorReport report = new DoctorReport(path.toString(), loaded.value().findings());
        FindingPrinter.print(report, json, spec.commandLine().getOut());
        return report.hasFailures() ? 1 : 0;
    }
}
