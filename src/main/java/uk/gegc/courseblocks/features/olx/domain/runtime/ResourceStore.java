package uk.gegc.courseblocks.features.olx.domain.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Course file store used for reading definition files on import and writing them on export.
 * Paths are relative and use {@code /} as separator.
 */
public interface ResourceStore {

    boolean exists(String path);

    /**
     * Opens {@code path} for reading. The caller closes the stream.
     *
     * @throws java.nio.file.NoSuchFileException if the path does not exist
     */
    InputStream open(String path) throws IOException;

    /**
     * Writes the complete content of {@code path} in one operation, replacing any previous content.
     */
    void write(String path, byte[] content) throws IOException;

    void makedirs(String path) throws IOException;

    default String readString(String path) throws IOException {
        try (InputStream input = open(path)) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
