package com.example.filematcher;

public enum ConfirmationState {
    PROMPTING,
    AUTO_CONFIRM_REMAINING,
    CANCELLED,
    DONE
}
