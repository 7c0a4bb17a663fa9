package dev.agentpanel.core.cli;

import dev.agentpanel.core.doctor.ConfigDoctor;
import dev.agentpanel.core.doctor.DoctorReport;
import dev.agentpanel.core.fs.DefaultFileSystem;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "doctor",
    description = "Check config.toml and the project paths it references.",
    mixinStandardHelpOptions = true,
    versionProvider = ApCommand.Version.class
)
final class DoctorCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ConfigPathOption config = new ConfigPathOption();

    @CommandLine.Option(names = "--json", description = "Print the report as JSON.")
    private boolean json;

    @Override
    public Integer call() {
        Path path = config.resolve();
        DoctorReport report = new DoctorReport(path.toString(), ConfigDoctor.check(path, new DefaultFileSystem()));
        FindingPrinter.print(report, json, spec.commandLine().getOut());
        return report.hasFailures() ? 1 : 0;
    }
}
