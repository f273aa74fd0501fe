package uk.gegc.courseblocks.features.olx.infra;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.courseblocks.features.olx.domain.runtime.ResourceStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * {@link ResourceStore} backed by a directory on the local file system.
 * <p>
 * Writes go to a temporary sibling file that is then moved over the target, so readers never see a partially
 * written definition.
 */
@Slf4j
public class FileSystemResourceStore implements ResourceStore {

    private final Path root;

    public FileSystemResourceStore(Path root) {
        if (root == null) {
            throw new IllegalArgumentException("Root directory cannot be null");
        }
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public boolean exists(String path) {
        return Files.isRegularFile(resolve(path));
    }

    @Override
    public InputStream open(String path) throws IOException {
        return Files.newInputStream(resolve(path));
    }

    @Override
    public void write(String path, byte[] content) throws IOException {
        Path output = resolve(path);
        Path parent = output.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = output.resolveSibling(output.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(tmp, content, StandardOpenOption.CREATE_NEW);
            try {
                Files.move(tmp, output, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, output, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            safeDelete(tmp);
            throw e;
        }
    }

    @Override
    public void makedirs(String path) throws IOException {
        Files.createDirectories(resolve(path));
    }

    private Path resolve(String path) {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        Path candidate = root.resolve(path.replaceAll("^/+", "")).normalize();
        if (!candidate.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the store root: " + path);
        }
        return candidate;
    }

    private void safeDelete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", path, e.getMessage());
        }
    }
}
