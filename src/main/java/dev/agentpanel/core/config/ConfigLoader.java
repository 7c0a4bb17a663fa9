package dev.agentpanel.core.config;

import dev.agentpanel.core.fs.FileSystem;
import dev.agentpanel.core.shared.Result;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads config.toml, writing the starter template first when the file does not exist yet.
 *
 * <p>Every failure is terminal for the call; retrying or falling back is the caller's decision.
 */
public final class ConfigLoader {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    public static Result<ConfigLoadResult, ConfigError> loadDefault(DataPaths paths, FileSystem fileSystem) {
        return load(paths.configFile(), fileSystem);
    }

    /**
     * Loads and parses the config at {@code path}.
     *
     * <p>A missing file is replaced by the starter template and reported as
     * {@link ConfigError.Kind#FILE_NOT_FOUND}: the write worked, but there is no real config yet.
     */
    public static Result<ConfigLoadResult, ConfigError> load(Path path, FileSystem fileSystem) {
        if (!fileSystem.exists(path)) {
            try {
                createStarterConfig(path, fileSystem);
            } catch (IOException ex) {
                LOG.warn("Unable to create starter config at {}: {}", path, ex.getMessage());
                return Result.err(new ConfigError(
                    ConfigError.Kind.CREATE_FAILED,
                    path,
                    "Failed to create config at " + path + ": " + describe(ex)
                ));
            }
            LOG.info("Created starter config at {}", path);
            return Result.err(new ConfigError(
                ConfigError.Kind.FILE_NOT_FOUND,
                path,
                "Config file not found. Created a starter config at " + path + ". Edit it to add projects."
            ));
        }

        byte[] data;
        try {
            data = fileSystem.readBytes(path);
        } catch (IOException ex) {
            LOG.warn("Unable to read config at {}: {}", path, ex.getMessage());
            return Result.err(new ConfigError(
                ConfigError.Kind.READ_FAILED,
                path,
                "Failed to read config at " + path + ": " + describe(ex)
            ));
        }

        String text;
        try {
            text = decodeUtf8(data);
        } catch (CharacterCodingException ex) {
            LOG.warn("Config at {} is not valid UTF-8", path);
            return Result.err(new ConfigError(
                ConfigError.Kind.READ_FAILED,
                path,
                "Failed to read config at " + path + ": file is not valid UTF-8."
            ));
        }
        return Result.ok(ConfigParser.parse(text));
    }

    /**
     * Collapses a load into a fully valid {@link Config} or a single {@link ConfigLoadError}.
     * Any FAIL finding makes the load a {@link ConfigLoadError.ValidationFailed}.
     */
    public static Result<Config, ConfigLoadError> loadValidated(Path path, FileSystem fileSystem) {
        Result<ConfigLoadResult, ConfigError> loaded = load(path, fileSystem);
        if (loaded.isErr()) {
            ConfigError error = loaded.error();
            if (error.kind() == ConfigError.Kind.FILE_NOT_FOUND) {
                return Result.err(new ConfigLoadError.FileNotFound(path.toString()));
            }
            return Result.err(new ConfigLoadError.ReadFailed(path.toString(), error.message()));
        }

        ConfigLoadResult result = loaded.value();
        List<ConfigFinding> failures = result.failures();
        if (result.hasParseError()) {
            ConfigFinding parseFailure = failures.get(0);
            return Result.err(new ConfigLoadError.ParseFailed(parseFailure.detail().orElse(parseFailure.title())));
        }
        if (!failures.isEmpty() || result.config().isEmpty()) {
            return Result.err(new ConfigLoadError.ValidationFailed(failures));
        }
        return Result.ok(result.config().get());
    }

    private static void createStarterConfig(Path path, FileSystem fileSystem) throws IOException {
        Path directory = path.getParent() != null ? path.getParent() : path.toAbsolutePath().getParent();
        if (directory != null) {
            fileSystem.createDirectory(directory);
        }
        fileSystem.writeBytes(path, StarterConfig.TEMPLATE.getBytes(StandardCharsets.UTF_8));
    }

    private static String decodeUtf8(byte[] data) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(data))
            .toString();
    }

    private static String describe(IOException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }
}
