package dev.agentpanel.core.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.agentpanel.core.config.DataPaths;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ApCommandTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private static Path writeConfig(Path dir, String content) throws IOException {
        Path config = dir.resolve("config.toml");
        Files.writeString(config, content, StandardCharsets.UTF_8);
        return config;
    }

    private static String projects(String root) {
        return "[[project]]\nname = \"Alpha\"\npath = \"" + root + "/alpha\"\ncolor = \"red\"\n"
            + "[[project]]\nname = \"Bravo\"\npath = \"" + root + "/bravo\"\ncolor = \"blue\"\n"
            + "[[project]]\nname = \"Charlie\"\npath = \"" + root + "/charlie\"\ncolor = \"green\"\n";
    }

    @Test
    void versionNamesTheCommandAndDefaultConfig() {
        assertEquals(0, run("--version"));
        String[] lines = out.toString().split("\n");
        assertTrue(lines[0].startsWith("ap "));
        assertEquals("config: " + DataPaths.forCurrentUser().configFile(), lines[1].strip());
    }

    @Test
    void validateDoesNotCreateAMissingConfig(@TempDir Path dir) {
        Path config = dir.resolve("config.toml");

        assertEquals(1, run("validate", "--config", config.toString()));
        assertFalse(Files.exists(config));
        assertTrue(err.toString().contains("configuration error: Config file not found"));
    }

    @Test
    void validateExitsNonZeroOnFailures(@TempDir Path dir) throws IOException {
        Path config = writeConfig(dir, "[layout]\nwindowHeight = 150\n");

        assertEquals(1, run("validate", "--config", config.toString()));
        assertTrue(out.toString().contains("FAIL  layout.windowHeight must be 1–100"));
    }

    @Test
    void validatePrintsJson(@TempDir Path dir) throws IOException {
        Path config = writeConfig(dir, projects(dir.toString()));

        assertEquals(0, run("validate", "--json", "--config", config.toString()));
        assertTrue(out.toString().contains("\"ok\" : true"));
    }

    @Test
    void initCreatesStarterOnce(@TempDir Path dir) {
        Path config = dir.resolve("agent-panel").resolve("config.toml");

        assertEquals(0, run("init", "--config", config.toString()));
        assertTrue(Files.isRegularFile(config));
        assertTrue(out.toString().contains("Created a starter config"));

        assertEquals(0, run("init", "--config", config.toString()));
        assertTrue(out.toString().contains("Config already exists at " + config));
    }

    @Test
    void projectsRanksByRecentFocus(@TempDir Path dir) throws IOException {
        Path config = writeConfig(dir, projects(dir.toString()));

        assertEquals(0, run("projects", "--config", config.toString(), "--recent", "bravo,alpha"));
        assertEquals("bravo\tBravo\t#0000FF\nalpha\tAlpha\t#FF0000\ncharlie\tCharlie\t#008000\n", out.toString().replace("\r\n", "\n"));
    }

    @Test
    void projectsRefusesAnInvalidConfig(@TempDir Path dir) throws IOException {
        Path config = writeConfig(dir, "[[project]]\nname = \"A\"\n");

        assertEquals(1, run("projects", "--config", config.toString()));
        assertTrue(err.toString().contains("validation error: Config validation failed (2 issues)"));
    }

    @Test
    void doctorReportsMissingProjectPaths(@TempDir Path dir) throws IOException {
        Files.createDirectory(dir.resolve("alpha"));
        Path config = writeConfig(dir, projects(dir.toString()));

        assertEquals(0, run("doctor", "--config", config.toString()));
        String text = out.toString();
        assertTrue(text.contains("PASS  Project path exists: alpha"));
        assertTrue(text.contains("WARN  Project path not found: bravo"));
        assertTrue(text.indexOf("WARN") < text.indexOf("PASS"));
    }

    @Test
    void autostartRewritesTheFlag(@TempDir Path dir) throws IOException {
        Path config = writeConfig(dir, "# mine\n[app]\nautoStartAtLogin = false\n");

        assertEquals(0, run("autostart", "--config", config.toString(), "true"));
        assertEquals("# mine\n[app]\nautoStartAtLogin = true\n", Files.readString(config, StandardCharsets.UTF_8));
    }
}
