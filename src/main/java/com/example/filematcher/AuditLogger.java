package com.example.filematcher;

import com.example.filematcher.model.Action;
import com.example.filematcher.model.ActionOutcome;
import com.example.filematcher.model.AuditLogEntry;
import com.example.filematcher.model.DuplicateGroup;
import com.example.filematcher.model.ExecutionSummary;
import com.example.filematcher.model.FailedOperation;
import com.example.filematcher.model.RunMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Append-only, human readable record of what a run actually did.
 *
 * <p>Line format: {@code [timestamp] ACTION duplicate -> master (size) [hash...] RESULT}. Timestamps never
 * go backwards even if the wall clock does.
 */
public final class AuditLogger implements AuditTrail, Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(AuditLogger.class);
    private static final String RULE = "=".repeat(80);
    private static final DateTimeFormatter FILE_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final String LOG_DIR_ENV = "FILEMATCHER_LOG_DIR";

    private final Path path;
    private final BufferedWriter writer;
    private final Clock clock;
    private Instant lastTimestamp = Instant.MIN;
    private int operationCount;
    private int failedWrites;

    private AuditLogger(Path path, BufferedWriter writer, Clock clock) {
        this.path = path;
        this.writer = writer;
        this.clock = clock;
    }

    static AuditLogger open(Path path) throws SetupException {
        return open(path, Clock.systemUTC());
    }

    /**
     * Opens the log and writes its header. A log that cannot take the header is a setup failure.
     */
    public static AuditLogger open(Path path, RunMetadata metadata) throws SetupException {
        return open(path, metadata, Clock.systemUTC());
    }

    static AuditLogger open(Path path, RunMetadata metadata, Clock clock) throws SetupException {
        AuditLogger logger = open(path, clock);
        try {
            logger.writeHeader(metadata);
            return logger;
        } catch (IOException ex) {
            try {
                logger.writer.close();
            } catch (IOException closeEx) {
                ex.addSuppressed(closeEx);
            }
            throw new SetupException("Cannot write audit log " + path + ": " + ex.getMessage(), ex);
        }
    }

    static AuditLogger open(Path path, Clock clock) throws SetupException {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            return new AuditLogger(path, writer, clock);
        } catch (IOException ex) {
            throw new SetupException("Cannot open audit log " + path + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Default log location: {@code filematcher_yyyyMMdd_HHmmss.log} in {@code $FILEMATCHER_LOG_DIR}
     * or the working directory.
     */
    public static Path defaultPath(LocalDateTime now, Optional<String> logDirectory) {
        String fileName = "filematcher_" + FILE_NAME_FORMAT.format(now) + ".log";
        return logDirectory.filter(value -> !value.isBlank())
                .map(directory -> Path.of(directory).resolve(fileName))
                .orElse(Path.of(fileName));
    }

    public Path path() {
        return path;
    }

    public int operationCount() {
        return operationCount;
    }

    /**
     * Number of lines that could not be written after the header. The run carries on regardless.
     */
    public int failedWrites() {
        return failedWrites;
    }

    private void writeHeader(RunMetadata metadata) throws IOException {
        String flags = metadata.flags().isEmpty() ? "none" : String.join(", ", metadata.flags());
        writeLine(RULE);
        writeLine("File Matcher Execution Log");
        writeLine(RULE);
        writeLine("Timestamp: " + nextTimestamp());
        writeLine("Directories: " + metadata.firstDirectory() + ", " + metadata.secondDirectory());
        writeLine("Master: " + metadata.masterDirectory());
        writeLine("Action: " + metadata.action().label());
        writeLine("Flags: " + flags);
        writeLine(RULE);
        writeLine("");
    }

    @Override
    public void logOperation(AuditLogEntry entry) {
        StringBuilder line = new StringBuilder()
                .append('[').append(monotonic(entry.timestamp())).append("] ")
                .append(entry.actionKind()).append(' ')
                .append(entry.duplicatePath());
        if (!Action.DELETE.name().equals(entry.actionKind())) {
            line.append(" -> ").append(entry.masterPath());
        }
        line.append(" (").append(FileSizes.format(entry.size())).append(") [")
                .append(entry.hashPrefix()).append("...] ")
                .append(entry.result());
        append(line.toString());
        operationCount++;
    }

    @Override
    public void logDeclined(DuplicateGroup group) {
        append("[" + nextTimestamp() + "] DECLINED " + group.masterPath()
                + " (" + group.duplicates().size() + " duplicates) [" + group.hashPrefix() + "...] SKIPPED: user declined");
    }

    public void writeFooter(ExecutionSummary summary) {
        append("");
        append(RULE);
        append("Summary");
        append(RULE);
        append("Finished: " + nextTimestamp());
        append("Total files processed: " + summary.total());
        append("Successful: " + summary.succeeded());
        append("Failed: " + summary.failed());
        append("Skipped: " + summary.skipped());
        append("Declined by user: " + summary.declined());
        append("Not processed (cancelled): " + summary.cancelledCount());
        append("Space saved: " + FileSizes.format(summary.bytesReclaimed()));
        if (summary.cancelled()) {
            append("Run cancelled by user");
        }
        if (!summary.failures().isEmpty()) {
            append("");
            append("Failed files:");
            for (FailedOperation failure : summary.failures()) {
                append("  - " + failure.path() + ": " + failure.error());
            }
        }
        append(RULE);
    }

    public static String resultText(ActionOutcome outcome) {
        return switch (outcome.status()) {
            case SUCCEEDED -> {
                if (outcome.alreadyLinked()) {
                    yield "OK (already linked)";
                }
                yield outcome.fallback() ? "OK (fallback)" : "OK";
            }
            case SKIPPED -> "SKIPPED: " + outcome.reason();
            case FAILED -> outcome.reason().isEmpty() ? "FAILED" : "FAILED: " + outcome.reason();
        };
    }

    private Instant nextTimestamp() {
        return monotonic(clock.instant());
    }

    private Instant monotonic(Instant candidate) {
        Instant now = candidate;
        if (now.isBefore(lastTimestamp)) {
            now = lastTimestamp;
        }
        lastTimestamp = now;
        return now;
    }

    private void append(String line) {
        try {
            writeLine(line);
        } catch (IOException ex) {
            recordFailure(ex);
        }
    }

    private void writeLine(String line) throws IOException {
        writer.write(line);
        writer.newLine();
        writer.flush();
    }

    private void recordFailure(IOException ex) {
        failedWrites++;
        if (failedWrites == 1) {
            LOGGER.error("Failed writing audit log {}: {}", path, ex.getMessage());
        } else {
            LOGGER.debug("Failed writing audit log {}", path, ex);
        }
    }

    @Override
    public void close() {
        LOGGER.debug("Closing audit log {}", path);
        try {
            writer.close();
        } catch (IOException ex) {
            recordFailure(ex);
        }
    }
}
