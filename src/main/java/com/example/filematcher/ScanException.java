package com.example.filematcher;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A file could not be read while computing its content hash.
 */
public class ScanException extends IOException {
    private final Path path;

    public ScanException(Path path, IOException cause) {
        super("Failed to hash " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
