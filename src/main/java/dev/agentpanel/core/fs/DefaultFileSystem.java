package dev.agentpanel.core.fs;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * {@link FileSystem} backed by {@code java.nio.file}.
 */
public final class DefaultFileSystem implements FileSystem {
    @Override
    public boolean exists(Path path) {
        return Files.exists(path);
    }

    @Override
    public byte[] readBytes(Path path) throws IOException {
        return Files.readAllBytes(path);
    }

    /**
     * Writes through a sibling temp file and a rename so readers never observe a partial file.
     */
    @Override
    public void writeBytes(Path path, byte[] data) throws IOException {
        Path absolute = path.toAbsolutePath();
        Path parent = absolute.getParent();
        Path temp = Files.createTempFile(parent, "." + absolute.getFileName(), ".tmp");
        try {
            Files.write(temp, data, StandardOpenOption.TRUNCATE_EXISTING);
            try {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public void createDirectory(Path path) throws IOException {
        Files.createDirectories(path);
    }
}
