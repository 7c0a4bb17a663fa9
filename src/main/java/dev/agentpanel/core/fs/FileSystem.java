package dev.agentpanel.core.fs;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Minimal filesystem capability consumed by the configuration pipeline, injectable for tests.
 */
public interface FileSystem {
    boolean exists(Path path);

    byte[] readBytes(Path path) throws IOException;

    void writeBytes(Path path, byte[] data) throws IOException;

    /**
     * Creates the directory and any missing parents; succeeds when it already exists.
     */
    void createDirectory(Path path) throws IOException;
}
