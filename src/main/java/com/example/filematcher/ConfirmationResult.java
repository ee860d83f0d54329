package com.example.filematcher;

import com.example.filematcher.model.DuplicateGroup;

import java.util.List;

/**
 * Decision for every group, in group order. Groups after a quit carry {@link ConfirmationDecision#CANCELLED}.
 */
public record ConfirmationResult(
        List<DecidedGroup> decisions,
        boolean cancelled
) {
    public ConfirmationResult {
        decisions = List.copyOf(decisions);
    }

    public List<DuplicateGroup> confirmedGroups() {
        return decisions.stream()
                .filter(decided -> decided.decision().isConfirmed())
                .map(DecidedGroup::group)
                .toList();
    }

    public static ConfirmationResult allConfirmed(List<DuplicateGroup> groups) {
        return new ConfirmationResult(groups.stream()
                .map(group -> new DecidedGroup(group, ConfirmationDecision.AUTO_CONFIRMED_REMAINING))
                .toList(), false);
    }
}
