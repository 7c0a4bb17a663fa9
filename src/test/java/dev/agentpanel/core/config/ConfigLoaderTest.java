package dev.agentpanel.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.agentpanel.core.fs.DefaultFileSystem;
import dev.agentpanel.core.support.InMemoryFileSystem;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {
    private static final Path CONFIG = Path.of("/home/me/.config/agent-panel/config.toml");
    private static final String ONE_PROJECT = "[[project]]\nname = \"App\"\npath = \"/app\"\ncolor = \"blue\"\n";

    @Test
    void missingFileWritesStarterAndReportsNotFound() {
        InMemoryFileSystem fs = new InMemoryFileSystem();

        var result = ConfigLoader.load(CONFIG, fs);

        assertTrue(result.isErr());
        assertEquals(ConfigError.Kind.FILE_NOT_FOUND, result.error().kind());
        assertTrue(result.error().message().contains("Created a starter config at " + CONFIG));
        assertEquals(StarterConfig.TEMPLATE, fs.content(CONFIG).orElseThrow());
        assertTrue(fs.isDirectory(CONFIG.getParent()));
    }

    @Test
    void secondLoadParsesTheStarter() {
        InMemoryFileSystem fs = new InMemoryFileSystem();
        ConfigLoader.load(CONFIG, fs);

        var result = ConfigLoader.load(CONFIG, fs);

        assertTrue(result.isOk());
        assertEquals(LayoutConfig.defaults(), result.value().config().orElseThrow().layout());
        assertEquals(0, result.value().failures().size());
    }

    @Test
    void starterWriteFailureIsCreateFailed() {
        var result = ConfigLoader.load(CONFIG, new InMemoryFileSystem().failingWrites());
        assertEquals(ConfigError.Kind.CREATE_FAILED, result.error().kind());
        assertEquals("fileSystem", result.error().toApCoreError().category().label());
    }

    @Test
    void directoryFailureIsCreateFailed() {
        var result = ConfigLoader.load(CONFIG, new InMemoryFileSystem().failingDirectoryCreation());
        assertEquals(ConfigError.Kind.CREATE_FAILED, result.error().kind());
    }

    @Test
    void unreadableFileIsReadFailed() {
        InMemoryFileSystem fs = new InMemoryFileSystem().withFile(CONFIG, ONE_PROJECT).failingReads();
        var result = ConfigLoader.load(CONFIG, fs);
        assertEquals(ConfigError.Kind.READ_FAILED, result.error().kind());
        assertTrue(result.error().message().contains("Permission denied"));
    }

    @Test
    void invalidUtf8IsReadFailed() {
        InMemoryFileSystem fs = new InMemoryFileSystem().withFile(CONFIG, new byte[] {(byte) 0xC3, (byte) 0x28});
        var result = ConfigLoader.load(CONFIG, fs);
        assertEquals(ConfigError.Kind.READ_FAILED, result.error().kind());
        assertTrue(result.error().message().endsWith("file is not valid UTF-8."));
    }

    @Test
    void loadDefaultUsesTheUserConfigPath() {
        DataPaths paths = new DataPaths(Path.of("/home/me"));
        InMemoryFileSystem fs = new InMemoryFileSystem().withFile(paths.configFile(), ONE_PROJECT);

        var result = ConfigLoader.loadDefault(paths, fs);

        assertEquals(CONFIG, paths.configFile());
        assertEquals("app", result.value().projects().get(0).id());
    }

    @Test
    void loadValidatedReturnsConfigWhenClean() {
        InMemoryFileSystem fs = new InMemoryFileSystem().withFile(CONFIG, ONE_PROJECT);
        var result = ConfigLoader.loadValidated(CONFIG, fs);
        assertEquals(1, result.value().projects().size());
    }

    @Test
    void loadValidatedCollapsesEachErrorKind() {
        assertInstanceOf(ConfigLoadError.FileNotFound.class,
            ConfigLoader.loadValidated(CONFIG, new InMemoryFileSystem()).error());
        assertInstanceOf(ConfigLoadError.ReadFailed.class,
            ConfigLoader.loadValidated(CONFIG, new InMemoryFileSystem().withFile(CONFIG, "x").failingReads()).error());
        assertInstanceOf(ConfigLoadError.ParseFailed.class,
            ConfigLoader.loadValidated(CONFIG, new InMemoryFileSystem().withFile(CONFIG, "[[project")).error());

        var invalid = ConfigLoader.loadValidated(CONFIG, new InMemoryFileSystem().withFile(CONFIG, "[layout]\nmaxGap = 500\n"));
        var failed = assertInstanceOf(ConfigLoadError.ValidationFailed.class, invalid.error());
        assertEquals("layout.maxGap must be 0–100", failed.findings().get(0).title());
    }

    @Test
    void worksAgainstTheRealFileSystem(@TempDir Path tempDir) throws Exception {
        Path config = tempDir.resolve("nested").resolve("config.toml");
        DefaultFileSystem fs = new DefaultFileSystem();

        assertEquals(ConfigError.Kind.FILE_NOT_FOUND, ConfigLoader.load(config, fs).error().kind());
        assertTrue(Files.isRegularFile(config));

        Files.writeString(config, ONE_PROJECT, StandardCharsets.UTF_8);
        assertEquals("app", ConfigLoader.load(config, fs).value().projects().get(0).id());
    }
}
