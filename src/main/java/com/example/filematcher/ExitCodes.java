package com.example.filematcher;

import com.example.filematcher.model.ExecutionSummary;

/**
 * Maps a run's outcome to the process exit status.
 */
public final class ExitCodes {
    public static final int SUCCESS = 0;
    public static final int TOTAL_FAILURE = 1;
    public static final int PARTIAL_FAILURE = 2;
    public static final int INTERRUPTED = 130;
    public static final int SETUP_ERROR = 1;

    private ExitCodes() {
    }

    public static int of(ExecutionSummary summary) {
        return of(summary, summary.cancelled());
    }

    public static int of(ExecutionSummary summary, boolean wasCancelled) {
        return of(summary.succeeded(), summary.failed(), wasCancelled);
    }

    public static int of(int succeeded, int failed, boolean wasCancelled) {
        if (wasCancelled) {
            return INTERRUPTED;
        }
        if (failed == 0) {
            return SUCCESS;
        }
        if (succeeded == 0) {
            return TOTAL_FAILURE;
        }
        return PARTIAL_FAILURE;
    }
}
