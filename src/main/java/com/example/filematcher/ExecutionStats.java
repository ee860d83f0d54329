package com.example.filematcher;

import com.example.filematcher.model.ActionOutcome;
import com.example.filematcher.model.ExecutionSummary;
import com.example.filematcher.model.FailedOperation;

import java.util.ArrayList;
import java.util.List;

/**
 * Running totals of a batch. {@link #snapshot(boolean)} freezes them into an {@link ExecutionSummary}.
 */
final class ExecutionStats {
    private int succeeded;
    private int failed;
    private int skipped;
    private int declined;
    private int cancelled;
    private long bytesReclaimed;
    private final List<FailedOperation> failures = new ArrayList<>();

    void record(String path, ActionOutcome outcome) {
        switch (outcome.status()) {
            case SUCCEEDED -> {
                succeeded++;
                bytesReclaimed += outcome.bytesReclaimed();
            }
            case FAILED -> {
                failed++;
                failures.add(new FailedOperation(path, outcome.reason()));
            }
            case SKIPPED -> skipped++;
        }
    }

    void addDeclined(int duplicates) {
        declined += duplicates;
    }

    void addCancelled(int duplicates) {
        cancelled += duplicates;
    }

    ExecutionSummary snapshot(boolean wasCancelled) {
        return new ExecutionSummary(succeeded, failed, skipped, declined, cancelled, bytesReclaimed, failures, wasCancelled);
    }
}
