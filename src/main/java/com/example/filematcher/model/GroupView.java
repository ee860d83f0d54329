package com.example.filematcher.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Read-only view of a duplicate group handed to report writers. Outcome fields stay empty in preview mode.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroupView(
        String masterPath,
        long masterSize,
        String hash,
        String reason,
        String action,
        List<DuplicateView> duplicates
) {
    public GroupView {
        duplicates = List.copyOf(duplicates);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DuplicateView(
            String path,
            long size,
            String hash,
            boolean crossFilesystem,
            String outcome,
            String error
    ) {
    }
}
