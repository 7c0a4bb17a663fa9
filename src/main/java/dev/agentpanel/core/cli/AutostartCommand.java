package dev.agentpanel.core.cli;

import dev.agentpanel.core.config.ConfigWriteBack;
import dev.agentpanel.core.fs.DefaultFileSystem;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "autostart",
    description = "Set app.autoStartAtLogin in config.toml, keeping the rest of the file intact.",
    mixinStandardHelpOptions = true,
    versionProvider = ApCommand.Version.class
)
final class AutostartCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ConfigPathOption config = new ConfigPathOption();

    @CommandLine.Parameters(index = "0", paramLabel = "true|false", description = "New value.")
    private boolean enabled;

    @Override
    public Integer call() {
        Path path = config.resolve();
        ConfigWriteBack.setAutoStartAtLogin(enabled, path, new DefaultFileSystem());
        spec.commandLine().getOut().println("app.autoStartAtLogin = " + enabled + " (" + path + ")");
        spec.commandLine().getOut().flush();
        return 0;
    }
}
