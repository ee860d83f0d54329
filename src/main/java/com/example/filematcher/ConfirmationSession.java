package com.example.filematcher;

import com.example.filematcher.model.DuplicateGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Per-group y/n/a/q confirmation.
 *
 * <pre>
 * PROMPTING --y--> PROMPTING               (confirmed)
 * PROMPTING --n--> PROMPTING               (skipped)
 * PROMPTING --a--> AUTO_CONFIRM_REMAINING  (this and all later groups confirmed)
 * PROMPTING --q--> CANCELLED               (nothing further confirmed)
 * PROMPTING --?--> PROMPTING               (same group asked again)
 * </pre>
 * After the last group, or once cancelled, the session is DONE.
 */
public final class ConfirmationSession {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfirmationSession.class);

    private final ConfirmationPrompter prompter;
    private final CancellationToken cancellationToken;
    private ConfirmationState state;

    public ConfirmationSession(ConfirmationPrompter prompter, boolean autoConfirm, CancellationToken cancellationToken) {
        this.prompter = prompter;
        this.cancellationToken = cancellationToken;
        this.state = autoConfirm ? ConfirmationState.AUTO_CONFIRM_REMAINING : ConfirmationState.PROMPTING;
    }

    public ConfirmationState state() {
        return state;
    }

    public ConfirmationResult run(List<DuplicateGroup> groups) {
        List<DecidedGroup> decisions = new ArrayList<>(groups.size());
        boolean cancelled = false;
        for (int i = 0; i < groups.size(); i++) {
            DuplicateGroup group = groups.get(i);
            if (!cancelled) {
                ConfirmationDecision decision = decide(group, i + 1, groups.size());
                decisions.add(new DecidedGroup(group, decision));
                cancelled = decision == ConfirmationDecision.CANCELLED;
                if (cancelled) {
                    LOGGER.info("Cancelled at group {} of {}", i + 1, groups.size());
                }
            } else {
                decisions.add(new DecidedGroup(group, ConfirmationDecision.CANCELLED));
            }
        }
        state = ConfirmationState.DONE;
        return new ConfirmationResult(decisions, cancelled);
    }

    /**
     * Decides a single group. Only valid while prompting or auto-confirming.
     */
    public ConfirmationDecision decide(DuplicateGroup group, int index, int total) {
        switch (state) {
            case AUTO_CONFIRM_REMAINING:
                return ConfirmationDecision.AUTO_CONFIRMED_REMAINING;
            case PROMPTING:
                break;
            default:
                throw new IllegalStateException("No further groups can be decided in state " + state);
        }
        while (true) {
            if (cancellationToken.isCancelled()) {
                state = ConfirmationState.CANCELLED;
                return ConfirmationDecision.CANCELLED;
            }
            Optional<String> response = prompter.ask(group, index, total);
            if (response.isEmpty()) {
                state = ConfirmationState.CANCELLED;
                return ConfirmationDecision.CANCELLED;
            }
            String answer = response.get().trim().toLowerCase(Locale.ROOT);
            switch (answer) {
                case "y", "yes" -> {
                    return ConfirmationDecision.CONFIRMED;
                }
                case "n", "no" -> {
                    return ConfirmationDecision.SKIPPED;
                }
                case "a", "all" -> {
                    state = ConfirmationState.AUTO_CONFIRM_REMAINING;
                    return ConfirmationDecision.AUTO_CONFIRMED_REMAINING;
                }
                case "q", "quit" -> {
                    state = ConfirmationState.CANCELLED;
                    return ConfirmationDecision.CANCELLED;
                }
                default -> prompter.invalidResponse(response.get());
            }
        }
    }
}
