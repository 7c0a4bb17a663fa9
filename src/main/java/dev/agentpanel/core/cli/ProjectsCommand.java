package dev.agentpanel.core.cli;

import dev.agentpanel.core.api.ApCoreException;
import dev.agentpanel.core.config.Config;
import dev.agentpanel.core.config.ConfigLoadError;
import dev.agentpanel.core.config.ConfigLoader;
import dev.agentpanel.core.config.ProjectColorPalette;
import dev.agentpanel.core.config.ProjectConfig;
import dev.agentpanel.core.fs.DefaultFileSystem;
import dev.agentpanel.core.shared.Result;
import dev.agentpanel.core.switcher.FocusEvent;
import dev.agentpanel.core.switcher.ProjectSorter;
import java.io.PrintWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

/**
 * Prints projects in switcher order as {@code id<TAB>name<TAB>#RRGGBB}.
 */
@CommandLine.Command(
    name = "projects",
    description = "List configured projects ranked by query match and recent focus.",
    mixinStandardHelpOptions = true,
    versionProvider = ApCommand.Version.class
)
final class ProjectsCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ConfigPathOption config = new ConfigPathOption();

    @CommandLine.Option(names = {"-q", "--query"}, description = "Filter by name or id (case-insensitive).")
    private String query = "";

    @CommandLine.Option(
        names = "--recent",
        split = ",",
        paramLabel = "ID",
        description = "Recently focused project ids, most recent first."
    )
    private List<String> recent = new ArrayList<>();

    @Override
    public Integer call() {
        Result<Config, ConfigLoadError> loaded = ConfigLoader.loadValidated(config.resolve(), new DefaultFileSystem());
        if (loaded.isErr()) {
            throw new ApCoreException(loaded.error().toApCoreError());
        }

        // History timestamps are irrelevant for ranking; only the order matters.
        Instant now = Instant.now();
        List<FocusEvent> history = new ArrayList<>(recent.size());
        for (String id : recent) {
            history.add(FocusEvent.projectActivated(id.strip(), now));
        }

        PrintWriter out = spec.commandLine().getOut();
        for (ProjectConfig project : ProjectSorter.sortedProjects(loaded.value().projects(), query, history)) {
            String color = ProjectColorPalette.resolve(project.color()).map(ProjectColorPalette::toHex).orElse(project.color());
            out.println(project.id() + "\t" + project.name() + "\t" + color);
        }
        out.flush();
        return 0;
    }
}
