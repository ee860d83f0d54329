package com.example.filematcher.model;

import java.util.List;

/**
 * Aggregate counts of a batch run. Declined counts duplicates the user chose not to process,
 * cancelled counts duplicates left untouched because the run was cancelled.
 */
public record ExecutionSummary(
        int succeeded,
        int failed,
        int skipped,
        int declined,
        int cancelledCount,
        long bytesReclaimed,
        List<FailedOperation> failures,
        boolean cancelled
) {
    public ExecutionSummary {
        failures = List.copyOf(failures);
    }

    public int attempted() {
        return succeeded + failed;
    }

    public int total() {
        return succeeded + failed + skipped;
    }

    public static ExecutionSummary empty() {
        return new ExecutionSummary(0, 0, 0, 0, 0, 0L, List.of(), false);
    }
}
