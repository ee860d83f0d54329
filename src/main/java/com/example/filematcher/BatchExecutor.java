package com.example.filematcher;

import com.example.filematcher.model.Action;
import com.example.filematcher.model.ActionOutcome;
import com.example.filematcher.model.AuditLogEntry;
import com.example.filematcher.model.DuplicateGroup;
import com.example.filematcher.model.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Runs the chosen action over every confirmed group. A failing duplicate never stops the batch;
 * cancellation is honoured between groups only.
 */
public class BatchExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchExecutor.class);

    private final LinkReplacer replacer;
    private final AuditTrail auditTrail;
    private final CancellationToken cancellationToken;
    private final Action action;
    private final boolean allowFallback;
    private final UnaryOperator<Path> linkPathResolver;
    private final Clock clock;

    public BatchExecutor(LinkReplacer replacer,
                         AuditTrail auditTrail,
                         CancellationToken cancellationToken,
                         Action action,
                         boolean allowFallback,
                         UnaryOperator<Path> linkPathResolver) {
        this(replacer, auditTrail, cancellationToken, action, allowFallback, linkPathResolver, Clock.systemUTC());
    }

    BatchExecutor(LinkReplacer replacer,
                  AuditTrail auditTrail,
                  CancellationToken cancellationToken,
                  Action action,
                  boolean allowFallback,
                  UnaryOperator<Path> linkPathResolver,
                  Clock clock) {
        if (!action.modifiesFiles()) {
            throw new IllegalArgumentException("Action " + action.label() + " cannot be executed.");
        }
        this.replacer = replacer;
        this.auditTrail = auditTrail == null ? AuditTrail.noop() : auditTrail;
        this.cancellationToken = cancellationToken;
        this.action = action;
        this.allowFallback = allowFallback;
        this.linkPathResolver = linkPathResolver == null ? UnaryOperator.identity() : linkPathResolver;
        this.clock = clock;
    }

    public BatchResult execute(List<DecidedGroup> decidedGroups, boolean confirmationCancelled) {
        ExecutionStats stats = new ExecutionStats();
        Map<Path, ActionOutcome> outcomes = new HashMap<>();
        int total = decidedGroups.stream().mapToInt(decided -> decided.group().duplicates().size()).sum();
        int processed = 0;

        for (DecidedGroup decided : decidedGroups) {
            DuplicateGroup group = decided.group();
            int duplicates = group.duplicates().size();
            if (decided.decision() == ConfirmationDecision.SKIPPED) {
                stats.addDeclined(duplicates);
                auditTrail.logDeclined(group);
                continue;
            }
            if (decided.decision() == ConfirmationDecision.CANCELLED || cancellationToken.isCancelled()) {
                stats.addCancelled(duplicates);
                continue;
            }

            Optional<String> masterProblem = replacer.verifyMaster(group.master(), group.hash());
            if (masterProblem.isPresent()) {
                LOGGER.warn("Skipping group of {}: {}", group.masterPath(), masterProblem.get());
                for (FileRecord duplicate : group.duplicates()) {
                    record(stats, outcomes, group, duplicate, ActionOutcome.skipped(action, masterProblem.get()));
                }
                processed += duplicates;
                continue;
            }

            for (FileRecord duplicate : group.duplicates()) {
                processed++;
                LOGGER.debug("Processing {}/{}: {}", processed, total, duplicate.path());
                ActionOutcome outcome = replacer.replace(duplicate, group.hash(), group.master(), action,
                        allowFallback, linkPathResolver.apply(duplicate.path()));
                if (outcome.isFailure()) {
                    LOGGER.warn("Failed to {} {}: {}", action.label(), duplicate.path(), outcome.reason());
                } else if (outcome.isSkipped()) {
                    LOGGER.info("Skipped {}: {}", duplicate.path(), outcome.reason());
                }
                record(stats, outcomes, group, duplicate, outcome);
            }
        }

        boolean cancelled = confirmationCancelled || cancellationToken.isCancelled();
        return new BatchResult(stats.snapshot(cancelled), outcomes);
    }

    private void record(ExecutionStats stats,
                        Map<Path, ActionOutcome> outcomes,
                        DuplicateGroup group,
                        FileRecord duplicate,
                        ActionOutcome outcome) {
        stats.record(duplicate.path().toString(), outcome);
        outcomes.put(duplicate.path(), outcome);
        auditTrail.logOperation(new AuditLogEntry(
                clock.instant(),
                outcome.appliedAction().name(),
                duplicate.path().toString(),
                group.masterPath().toString(),
                duplicate.size(),
                group.hashPrefix(),
                AuditLogger.resultText(outcome)
        ));
    }
}
