package com.example.filematcher.model;

import java.time.Instant;
import java.util.List;

/**
 * Run parameters recorded once in the audit log header.
 */
public record RunMetadata(
        Instant startedAt,
        String firstDirectory,
        String secondDirectory,
        String masterDirectory,
        Action action,
        List<String> flags
) {
    public RunMetadata {
        flags = List.copyOf(flags);
    }
}
