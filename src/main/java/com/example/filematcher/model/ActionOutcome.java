package com.example.filematcher.model;

/**
 * Result of acting on a single duplicate.
 */
public record ActionOutcome(
        Status status,
        String reason,
        long bytesReclaimed,
        Action appliedAction,
        boolean fallback,
        boolean alreadyLinked
) {
    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    public static ActionOutcome succeeded(Action appliedAction, long bytesReclaimed) {
        return new ActionOutcome(Status.SUCCEEDED, "", bytesReclaimed, appliedAction, false, false);
    }

    public static ActionOutcome succeededWithFallback(long bytesReclaimed) {
        return new ActionOutcome(Status.SUCCEEDED, "", bytesReclaimed, Action.SYMLINK, true, false);
    }

    public static ActionOutcome alreadyLinked(Action appliedAction) {
        return new ActionOutcome(Status.SUCCEEDED, "already linked to master", 0L, appliedAction, false, true);
    }

    public static ActionOutcome failed(Action appliedAction, String reason) {
        return new ActionOutcome(Status.FAILED, reason, 0L, appliedAction, false, false);
    }

    public static ActionOutcome failedFallback(String reason) {
        return new ActionOutcome(Status.FAILED, reason, 0L, Action.SYMLINK, true, false);
    }

    public static ActionOutcome skipped(Action appliedAction, String reason) {
        return new ActionOutcome(Status.SKIPPED, reason, 0L, appliedAction, false, false);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }
}
