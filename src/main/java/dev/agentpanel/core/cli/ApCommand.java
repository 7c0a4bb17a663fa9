package dev.agentpanel.core.cli;

import dev.agentpanel.core.config.DataPaths;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "ap",
    description = "Validate and inspect the AgentPanel configuration.",
    mixinStandardHelpOptions = true,
    versionProvider = ApCommand.Version.class,
    subcommands = {
        ValidateCommand.class,
        DoctorCommand.class,
        ProjectsCommand.class,
        InitCommand.class,
        AutostartCommand.class
    }
)
final class ApCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Jar manifest version plus the config file every subcommand defaults to.
     */
    static final class Version implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = ApCommand.class.getPackage().getImplementationVersion();
            return new String[] {
                "ap " + (version == null ? "dev" : version),
                "config: " + DataPaths.forCurrentUser().configFile()
            };
        }
    }
}
