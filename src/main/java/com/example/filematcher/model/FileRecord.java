package com.example.filematcher.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Snapshot of a regular file taken when its directory was indexed.
 */
public record FileRecord(
        Path path,
        long size,
        Instant lastModifiedTime,
        String deviceId
) {
    public String name() {
        return path.getFileName() == null ? path.toString() : path.getFileName().toString();
    }
}
