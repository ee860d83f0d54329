package com.example.filematcher;

import com.example.filematcher.model.Action;
import com.example.filematcher.model.DuplicateGroup;
import com.example.filematcher.model.ExecutionSummary;
import com.example.filematcher.model.FileRecord;
import com.example.filematcher.model.GroupView;
import com.example.filematcher.model.MatchReport;
import com.example.filematcher.model.RunMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Orchestrates a run: index both trees, match, optionally confirm and execute, then report.
 */
public final class FileMatcherEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileMatcherEngine.class);

    private final MatcherConfig config;
    private final FileOperations fileOperations;
    private final Optional<ConfirmationPrompter> prompter;
    private final CancellationToken cancellationToken;
    private final ContentHasher hasher = new ContentHasher();
    private final ReportWriter reportWriter = new ReportWriter();

    /**
     * @param prompter used for interactive confirmation; empty when no terminal is attached
     */
    public FileMatcherEngine(MatcherConfig config,
                             FileOperations fileOperations,
                             Optional<ConfirmationPrompter> prompter,
                             CancellationToken cancellationToken) {
        this.config = config;
        this.fileOperations = fileOperations;
        this.prompter = prompter;
        this.cancellationToken = cancellationToken;
    }

    public RunResult run() throws SetupException, IOException {
        Path masterRoot = requireDirectory(config.firstDirectory());
        Path otherRoot = requireDirectory(config.secondDirectory());
        LOGGER.info("Using {} hashing", config.hashAlgorithm());
        if (config.fastMode()) {
            LOGGER.info("Fast mode enabled: files over {} are compared by sampled content",
                    FileSizes.format(ContentHasher.FAST_MODE_THRESHOLD));
        }

        DirectoryIndexer indexer = new DirectoryIndexer(hasher);
        HashIndex masterIndex = indexer.index(masterRoot, config.hashAlgorithm(), config.fastMode());
        HashIndex otherIndex = indexer.index(otherRoot, config.hashAlgorithm(), config.fastMode());
        MatchResult matched = new DuplicateMatcher().findDuplicates(masterIndex, otherIndex, masterRoot, config.differentNamesOnly());
        // Copies sharing storage with their master reclaim nothing, whatever the action.
        MatchResult match = matched.withoutDuplicates((master, duplicate) -> fileOperations.isHardLinkTo(duplicate.path(), master.path()));
        int alreadyHardlinked = matched.duplicateCount() - match.duplicateCount();
        Set<Path> crossFilesystem = crossFilesystemDuplicates(match.groups());

        if (!config.executesActions() || match.groups().isEmpty()) {
            List<GroupView> views = reportWriter.views(match, config, crossFilesystem, Map.of());
            return finish(reportWriter.report(match, config, masterRoot, otherRoot, views, alreadyHardlinked, List.of(),
                    null, null, ExitCodes.SUCCESS));
        }

        if (!config.assumeYes() && prompter.isEmpty()) {
            throw new SetupException("Non-interactive mode detected. Set \"assumeYes\": true to confirm all groups without prompting.");
        }
        if (!crossFilesystem.isEmpty() && !config.fallbackSymlink()) {
            LOGGER.warn("{} duplicate(s) are on a different filesystem than their master and cannot be hard linked",
                    crossFilesystem.size());
        }

        // Prompting happens before the audit log exists, so an interrupt at a prompt leaves nothing behind.
        ConfirmationResult confirmation = config.assumeYes()
                ? ConfirmationResult.allConfirmed(match.groups())
                : new ConfirmationSession(prompter.orElseThrow(), false, cancellationToken).run(match.groups());

        Path auditPath = config.auditLog().orElseGet(() ->
                AuditLogger.defaultPath(LocalDateTime.now(), Optional.ofNullable(System.getenv(AuditLogger.LOG_DIR_ENV))));
        RunMetadata metadata = new RunMetadata(
                Instant.now(),
                masterRoot.toString(),
                otherRoot.toString(),
                masterRoot.toString(),
                config.action(),
                config.flags()
        );
        BatchResult batch;
        int failedAuditWrites;
        cancellationToken.markExecuting();
        try {
            AuditLogger auditLogger = AuditLogger.open(auditPath, metadata);
            try (auditLogger) {
                LinkReplacer replacer = new LinkReplacer(fileOperations, hasher, config.hashAlgorithm(), config.fastMode());
                BatchExecutor executor = new BatchExecutor(replacer, auditLogger, cancellationToken, config.action(),
                        config.fallbackSymlink(), linkPathResolver(otherRoot));
                batch = executor.execute(confirmation.decisions(), confirmation.cancelled());
                auditLogger.writeFooter(batch.summary());
            }
            failedAuditWrites = auditLogger.failedWrites();
        } finally {
            cancellationToken.markFinished();
        }

        ExecutionSummary summary = batch.summary();
        int exitCode = ExitCodes.of(summary);
        List<String> runWarnings = failedAuditWrites == 0
                ? List.of()
                : List.of("Audit log " + auditPath + " is incomplete: " + failedAuditWrites + " write(s) failed");
        List<GroupView> views = reportWriter.views(match, config, crossFilesystem, batch.outcomes());
        return finish(reportWriter.report(match, config, masterRoot, otherRoot, views, alreadyHardlinked, runWarnings,
                summary, auditPath, exitCode));
    }

    private RunResult finish(MatchReport report) throws IOException {
        reportWriter.logSummary(report);
        if (config.reportFile().isPresent()) {
            reportWriter.write(report, config.reportFile().get());
        }
        return new RunResult(report.exitCode(), report);
    }

    private Path requireDirectory(Path directory) throws SetupException {
        if (!Files.isDirectory(directory)) {
            throw new SetupException("Not a directory: " + directory);
        }
        try {
            return directory.toRealPath();
        } catch (IOException ex) {
            throw new SetupException("Cannot resolve directory " + directory + ": " + ex.getMessage(), ex);
        }
    }

    private Set<Path> crossFilesystemDuplicates(List<DuplicateGroup> groups) {
        Set<Path> crossFilesystem = new HashSet<>();
        if (config.action() != Action.HARDLINK) {
            return crossFilesystem;
        }
        for (DuplicateGroup group : groups) {
            for (FileRecord duplicate : group.duplicates()) {
                if (!Objects.equals(duplicate.deviceId(), group.master().deviceId())) {
                    crossFilesystem.add(duplicate.path());
                }
            }
        }
        return crossFilesystem;
    }

    /**
     * Without a target directory links replace the duplicate in place. With one, a duplicate from the
     * second tree is linked at the same relative location under the target directory. Duplicates inside
     * the master tree are always linked in place, so they never collide with second-tree paths.
     */
    private UnaryOperator<Path> linkPathResolver(Path otherRoot) {
        if (config.targetDirectory().isEmpty()) {
            return UnaryOperator.identity();
        }
        Path target = config.targetDirectory().get().toAbsolutePath().normalize();
        return duplicate -> duplicate.startsWith(otherRoot) ? target.resolve(otherRoot.relativize(duplicate)) : duplicate;
    }
}
