package com.example.filematcher;

public enum ConfirmationDecision {
    CONFIRMED,
    SKIPPED,
    AUTO_CONFIRMED_REMAINING,
    CANCELLED;

    public boolean isConfirmed() {
        return this == CONFIRMED || this == AUTO_CONFIRMED_REMAINING;
    }
}
