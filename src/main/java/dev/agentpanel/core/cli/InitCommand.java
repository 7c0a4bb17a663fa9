package dev.agentpanel.core.cli;

import dev.agentpanel.core.api.ApCoreException;
import dev.agentpanel.core.config.ConfigError;
import dev.agentpanel.core.config.ConfigLoadResult;
import dev.agentpanel.core.config.ConfigLoader;
import dev.agentpanel.core.fs.DefaultFileSystem;
import dev.agentpanel.core.shared.Result;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "init",
    description = "Create a starter config.toml when none exists.",
    mixinStandardHelpOptions = true,
    versionProvider = ApCommand.Version.class
)
final class InitCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ConfigPathOption config = new ConfigPathOption();

    @Override
    public Integer call() {
        Path path = config.resolve();
        Result<ConfigLoadResult, ConfigError> loaded = ConfigLoader.load(path, new DefaultFileSystem());
        PrintWriter out = spec.commandLine().getOut();
        if (loaded.isOk()) {
            out.println("Config already exists at " + path);
            out.flush();
            return 0;
        }
        ConfigError error = loaded.error();
        if (error.kind() != ConfigError.Kind.FILE_NOT_FOUND) {
            throw new ApCoreException(error.toApCoreError());
        }
        out.println(error.message());
        out.flush();
        return 0;
    }
}
