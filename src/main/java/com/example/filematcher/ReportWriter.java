package com.example.filematcher;

import com.example.filematcher.model.ActionOutcome;
import com.example.filematcher.model.DuplicateGroup;
import com.example.filematcher.model.ExecutionSummary;
import com.example.filematcher.model.FailedOperation;
import com.example.filematcher.model.FileRecord;
import com.example.filematcher.model.GroupView;
import com.example.filematcher.model.MatchReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns core results into read-only views, writes them as JSON and logs a short summary.
 */
public class ReportWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper mapper;

    public ReportWriter() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    ReportWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<GroupView> views(MatchResult match, MatcherConfig config, Set<Path> crossFilesystem, Map<Path, ActionOutcome> outcomes) {
        return match.groups().stream()
                .map(group -> view(group, config, crossFilesystem, outcomes))
                .toList();
    }

    private GroupView view(DuplicateGroup group, MatcherConfig config, Set<Path> crossFilesystem, Map<Path, ActionOutcome> outcomes) {
        List<GroupView.DuplicateView> duplicates = group.duplicates().stream()
                .map(duplicate -> duplicateView(group, duplicate, crossFilesystem, outcomes.get(duplicate.path())))
                .toList();
        return new GroupView(
                group.masterPath().toString(),
                group.master().size(),
                group.hash(),
                group.reason().description(),
                config.action().label(),
                duplicates
        );
    }

    private GroupView.DuplicateView duplicateView(DuplicateGroup group, FileRecord duplicate, Set<Path> crossFilesystem, ActionOutcome outcome) {
        String status = outcome == null ? null : AuditLogger.resultText(outcome);
        String error = outcome != null && outcome.isFailure() ? outcome.reason() : null;
        return new GroupView.DuplicateView(
                duplicate.path().toString(),
                duplicate.size(),
                group.hash(),
                crossFilesystem.contains(duplicate.path()),
                status,
                error
        );
    }

    public MatchReport report(MatchResult match,
                              MatcherConfig config,
                              Path masterRoot,
                              Path otherRoot,
                              List<GroupView> groups,
                              int alreadyHardlinked,
                              List<String> runWarnings,
                              ExecutionSummary execution,
                              Path auditLog,
                              int exitCode) {
        List<String> warnings = new ArrayList<>(match.warnings());
        warnings.addAll(runWarnings);
        return new MatchReport(
                Instant.now(),
                masterRoot.toString(),
                otherRoot.toString(),
                config.action().label(),
                config.hashAlgorithm().name().toLowerCase(Locale.ROOT),
                execution != null,
                match.reclaimableBytes(),
                alreadyHardlinked,
                groups,
                match.unmatchedFirst().stream().map(Path::toString).toList(),
                match.unmatchedSecond().stream().map(Path::toString).toList(),
                List.copyOf(warnings),
                execution,
                auditLog == null ? null : auditLog.toString(),
                exitCode
        );
    }

    public void write(MatchReport report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), report);
        LOGGER.info("Report written to {}", target);
    }

    public void logSummary(MatchReport report) {
        report.warnings().forEach(warning -> LOGGER.warn("{}", warning));
        int duplicates = report.groups().stream().mapToInt(group -> group.duplicates().size()).sum();
        LOGGER.info("{} duplicate group(s), {} duplicate file(s), {} reclaimable",
                report.groups().size(), duplicates, FileSizes.format(report.reclaimableBytes()));
        if (report.alreadyHardlinked() > 0) {
            LOGGER.info("Skipped {} file(s) already hard linked to their master", report.alreadyHardlinked());
        }
        LOGGER.info("Unmatched: {} in {}, {} in {}",
                report.unmatchedMaster().size(), report.masterDirectory(),
                report.unmatchedOther().size(), report.otherDirectory());
        ExecutionSummary execution = report.execution();
        if (execution == null) {
            if (!"compare".equals(report.action())) {
                LOGGER.info("Preview only: nothing was changed (set execute to apply {}).", report.action());
            }
            return;
        }
        LOGGER.info("Executed {}: {} succeeded, {} failed, {} skipped, {} declined, {} not processed, {} reclaimed",
                report.action(), execution.succeeded(), execution.failed(), execution.skipped(),
                execution.declined(), execution.cancelledCount(), FileSizes.format(execution.bytesReclaimed()));
        for (FailedOperation failure : execution.failures()) {
            LOGGER.error("  {}: {}", failure.path(), failure.error());
        }
        if (report.auditLog() != null) {
            LOGGER.info("Audit log: {}", report.auditLog());
        }
    }
}
