package com.example.filematcher;

import com.example.filematcher.model.Action;
import com.example.filematcher.model.AuditLogEntry;
import com.example.filematcher.model.DuplicateGroup;
import com.example.filematcher.model.ExecutionSummary;
import com.example.filematcher.model.FileRecord;
import com.example.filematcher.model.HashAlgorithm;
import com.example.filematcher.model.MasterReason;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchExecutorTest {
    private static final Instant OLD = Instant.parse("2020-01-01T00:00:00Z");

    private final ContentHasher hasher = new ContentHasher();
    private final RecordingAuditTrail audit = new RecordingAuditTrail();

    @Test
    void continuesAfterFailuresAndCountsEverything() throws Exception {
        Path root = Files.createTempDirectory("batch-continue");
        DuplicateGroup good = group(root, "good", "first content", 1);
        DuplicateGroup alsoGood = group(root, "also-good", "second content", 2);
        ScriptedFileOperations operations = new ScriptedFileOperations();
        operations.createSymbolicLinkFailure = new IOException("no symlinks here");

        BatchResult result = executor(operations, Action.HARDLINK, new CancellationToken())
                .execute(confirmed(good, alsoGood), false);

        ExecutionSummary summary = result.summary();
        assertEquals(3, summary.succeeded());
        assertEquals(0, summary.failed());
        assertEquals(3, audit.entries.size());
        assertEquals(good.duplicates().get(0).size() + alsoGood.duplicateBytes(), summary.bytesReclaimed());

        DuplicateGroup failing = group(root, "failing", "third content", 2);
        BatchResult failed = executor(operations, Action.SYMLINK, new CancellationToken())
                .execute(confirmed(failing), false);
        assertEquals(2, failed.summary().failed());
        assertEquals(2, failed.summary().failures().size());
        assertEquals(ExitCodes.TOTAL_FAILURE, ExitCodes.of(failed.summary()));
        for (FileRecord duplicate : failing.duplicates()) {
            assertTrue(Files.isRegularFile(duplicate.path()));
        }
    }

    @Test
    void raceSkipsDoNotStopTheBatch() throws Exception {
        Path root = Files.createTempDirectory("batch-mixed");
        DuplicateGroup ok = group(root, "ok", "kept", 1);
        DuplicateGroup broken = group(root, "broken", "broken", 1);
        Files.delete(broken.master().path());
        DuplicateGroup changed = group(root, "changed", "changing", 1);
        Files.writeString(changed.duplicates().get(0).path(), "edited");

        BatchResult result = executor(new NioFileOperations(), Action.DELETE, new CancellationToken())
                .execute(confirmed(ok, broken, changed), false);

        ExecutionSummary summary = result.summary();
        assertEquals(1, summary.succeeded());
        assertEquals(2, summary.skipped());
        assertEquals(0, summary.failed());
        assertEquals(ExitCodes.SUCCESS, ExitCodes.of(summary));
        assertTrue(Files.exists(broken.duplicates().get(0).path()));
        assertEquals("SKIPPED: master missing", audit.entries.get(1).result());
        assertEquals("SKIPPED: content changed since scan", audit.entries.get(2).result());
    }

    @Test
    void declinedGroupsAreRecordedButNotExecuted() throws Exception {
        Path root = Files.createTempDirectory("batch-declined");
        DuplicateGroup first = group(root, "first", "one", 1);
        DuplicateGroup second = group(root, "second", "two", 2);

        BatchResult result = executor(new NioFileOperations(), Action.DELETE, new CancellationToken()).execute(List.of(
                new DecidedGroup(first, ConfirmationDecision.CONFIRMED),
                new DecidedGroup(second, ConfirmationDecision.SKIPPED)
        ), false);

        assertEquals(1, result.summary().succeeded());
        assertEquals(2, result.summary().declined());
        assertEquals(List.of(second), audit.declined);
        assertEquals(1, audit.entries.size());
        for (FileRecord duplicate : second.duplicates()) {
            assertTrue(Files.exists(duplicate.path()));
        }
    }

    @Test
    void cancellationStopsAtGroupBoundary() throws Exception {
        Path root = Files.createTempDirectory("batch-cancel");
        DuplicateGroup first = group(root, "first", "one", 2);
        DuplicateGroup second = group(root, "second", "two", 1);
        CancellationToken token = new CancellationToken();
        RecordingAuditTrail cancellingAudit = new RecordingAuditTrail() {
            @Override
            public void logOperation(AuditLogEntry entry) {
                super.logOperation(entry);
                token.cancel();
            }
        };
        LinkReplacer replacer = new LinkReplacer(new NioFileOperations(), hasher, HashAlgorithm.MD5, false);

        BatchResult result = new BatchExecutor(replacer, cancellingAudit, token, Action.DELETE, false, null)
                .execute(confirmed(first, second), false);

        // Both duplicates of the group in progress are finished, the next group is not started.
        assertEquals(2, result.summary().succeeded());
        assertEquals(1, result.summary().cancelledCount());
        assertTrue(result.summary().cancelled());
        assertTrue(Files.exists(second.duplicates().get(0).path()));
        assertEquals(ExitCodes.INTERRUPTED, ExitCodes.of(result.summary()));
    }

    @Test
    void cancelledDecisionsAreNeverExecuted() throws Exception {
        Path root = Files.createTempDirectory("batch-quit");
        DuplicateGroup first = group(root, "first", "one", 1);
        DuplicateGroup second = group(root, "second", "two", 1);

        BatchResult result = executor(new NioFileOperations(), Action.DELETE, new CancellationToken()).execute(List.of(
                new DecidedGroup(first, ConfirmationDecision.CONFIRMED),
                new DecidedGroup(second, ConfirmationDecision.CANCELLED)
        ), true);

        assertEquals(1, result.summary().succeeded());
        assertEquals(1, result.summary().cancelledCount());
        assertTrue(result.summary().cancelled());
        assertFalse(Files.exists(first.duplicates().get(0).path()));
        assertTrue(Files.exists(second.duplicates().get(0).path()));
    }

    private BatchExecutor executor(FileOperations operations, Action action, CancellationToken token) {
        LinkReplacer replacer = new LinkReplacer(operations, hasher, HashAlgorithm.MD5, false);
        return new BatchExecutor(replacer, audit, token, action, false, null);
    }

    private static List<DecidedGroup> confirmed(DuplicateGroup... groups) {
        List<DecidedGroup> decided = new ArrayList<>();
        for (DuplicateGroup group : groups) {
            decided.add(new DecidedGroup(group, ConfirmationDecision.CONFIRMED));
        }
        return decided;
    }

    private DuplicateGroup group(Path root, String name, String content, int duplicates) throws IOException {
        FileRecord master = TestFiles.record(TestFiles.write(root.resolve("master/" + name + ".txt"), content, OLD));
        List<FileRecord> copies = new ArrayList<>();
        for (int i = 0; i < duplicates; i++) {
            Path copy = TestFiles.write(root.resolve("other/" + name + "-" + i + ".txt"), content, OLD.plusSeconds(i + 1));
            copies.add(TestFiles.record(copy));
        }
        String hash = hasher.hash(master.path(), HashAlgorithm.MD5, false);
        return new DuplicateGroup(hash, master, copies, MasterReason.IN_MASTER_DIRECTORY);
    }

    static class RecordingAuditTrail implements AuditTrail {
        final List<AuditLogEntry> entries = new ArrayList<>();
        final List<DuplicateGroup> declined = new ArrayList<>();

        @Override
        public void logOperation(AuditLogEntry entry) {
            entries.add(entry);
        }

        @Override
        public void logDeclined(DuplicateGroup group) {
            declined.add(group);
        }
    }
}
