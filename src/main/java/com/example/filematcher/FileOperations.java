package com.example.filematcher;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Filesystem primitives used when replacing duplicates. Every mutation of the tree goes through here.
 */
public interface FileOperations {
    boolean exists(Path path);

    /**
     * Renames {@code source} to {@code target} atomically. An existing {@code target} may be replaced
     * (POSIX rename), so callers pass a target they know to be free.
     */
    void move(Path source, Path target) throws IOException;

    /**
     * Creates a hard link. Throws {@link CrossFilesystemException} when the filesystem refuses
     * because {@code link} and {@code existing} are on different devices.
     */
    void createLink(Path link, Path existing) throws IOException;

    void createSymbolicLink(Path link, Path target) throws IOException;

    void delete(Path path) throws IOException;

    void createDirectories(Path directory) throws IOException;

    boolean isHardLinkTo(Path path, Path other);

    boolean isSymbolicLinkTo(Path path, Path target);
}
