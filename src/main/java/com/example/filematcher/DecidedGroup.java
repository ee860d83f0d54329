package com.example.filematcher;

import com.example.filematcher.model.DuplicateGroup;

public record DecidedGroup(
        DuplicateGroup group,
        ConfirmationDecision decision
) {
}
