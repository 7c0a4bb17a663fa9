package dev.agentpanel.core.config;

import dev.agentpanel.core.api.ApCoreError;
import java.nio.file.Path;
import java.util.Objects;

/**
 * The configuration text could not be obtained. Content problems are {@link ConfigFinding}s instead.
 */
public record ConfigError(Kind kind, Path path, String message) {
    public ConfigError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(message, "message");
    }

    public enum Kind {
        /** File was absent; a starter config has been written in its place. */
        FILE_NOT_FOUND,
        /** The starter config could not be written. */
        CREATE_FAILED,
        /** The file exists but is unreadable or not UTF-8 text. */
        READ_FAILED
    }

    public ApCoreError toApCoreError() {
        if (kind == Kind.FILE_NOT_FOUND) {
            return ApCoreError.configuration(message, path.toString());
        }
        return ApCoreError.fileSystem(message, path.toString());
    }
}
