package com.example.filematcher.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Serialized result of a run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchReport(
        Instant generatedAt,
        String masterDirectory,
        String otherDirectory,
        String action,
        String hashAlgorithm,
        boolean executed,
        long reclaimableBytes,
        int alreadyHardlinked,
        List<GroupView> groups,
        List<String> unmatchedMaster,
        List<String> unmatchedOther,
        List<String> warnings,
        ExecutionSummary execution,
        String auditLog,
        int exitCode
) {
}
