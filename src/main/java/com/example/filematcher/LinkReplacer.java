package com.example.filematcher;

import com.example.filematcher.model.Action;
import com.example.filematcher.model.ActionOutcome;
import com.example.filematcher.model.FileRecord;
import com.example.filematcher.model.HashAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Replaces one duplicate with a link to its master (or deletes it) without ever leaving the
 * duplicate's path empty on failure.
 *
 * <p>The duplicate is first renamed to a temporary name in its own directory. From then on either
 * the link is created and the temporary file removed, or the temporary file is renamed back.
 */
public class LinkReplacer {
    private static final Logger LOGGER = LoggerFactory.getLogger(LinkReplacer.class);
    static final String TEMP_SUFFIX = ".filematcher_tmp";

    private final FileOperations fileOperations;
    private final ContentHasher hasher;
    private final HashAlgorithm algorithm;
    private final boolean fastMode;

    public LinkReplacer(FileOperations fileOperations, ContentHasher hasher, HashAlgorithm algorithm, boolean fastMode) {
        this.fileOperations = fileOperations;
        this.hasher = hasher;
        this.algorithm = algorithm;
        this.fastMode = fastMode;
    }

    public ActionOutcome replace(FileRecord duplicate, String expectedHash, FileRecord master, Action action, boolean allowFallback) {
        return replace(duplicate, expectedHash, master, action, allowFallback, duplicate.path());
    }

    /**
     * Applies {@code action} to {@code duplicate}. For link actions the link is created at {@code linkPath},
     * which is the duplicate's own path unless links go to an alternate target directory.
     */
    public ActionOutcome replace(FileRecord duplicate,
                                 String expectedHash,
                                 FileRecord master,
                                 Action action,
                                 boolean allowFallback,
                                 Path linkPath) {
        if (!action.modifiesFiles()) {
            throw new IllegalArgumentException("Action " + action.label() + " does not modify files.");
        }
        Path path = duplicate.path();
        Path masterPath = master.path();

        if (!fileOperations.exists(path)) {
            return ActionOutcome.skipped(action, "duplicate missing");
        }
        String currentHash;
        try {
            currentHash = hasher.hash(path, algorithm, fastMode);
        } catch (ScanException ex) {
            if (!fileOperations.exists(path)) {
                return ActionOutcome.skipped(action, "duplicate missing");
            }
            return ActionOutcome.failed(action, "Could not re-verify duplicate: " + ex.getCause().getMessage());
        }
        if (!currentHash.equals(expectedHash)) {
            return ActionOutcome.skipped(action, "content changed since scan");
        }

        if (fileOperations.isSymbolicLinkTo(path, masterPath)) {
            return ActionOutcome.alreadyLinked(Action.SYMLINK);
        }
        if (fileOperations.isHardLinkTo(path, masterPath)) {
            return ActionOutcome.alreadyLinked(Action.HARDLINK);
        }

        long size = duplicate.size();
        Path temp = temporaryPathFor(path);
        try {
            fileOperations.move(path, temp);
        } catch (IOException ex) {
            return ActionOutcome.failed(action, "Failed to rename to temp: " + describe(ex));
        }

        Action applied = action;
        boolean fallback = false;
        boolean linkCreated = false;
        try {
            if (action.createsLink()) {
                if (!linkPath.equals(path) && linkPath.getParent() != null) {
                    fileOperations.createDirectories(linkPath.getParent());
                }
                try {
                    createLink(action, linkPath, masterPath);
                } catch (CrossFilesystemException ex) {
                    if (!allowFallback) {
                        throw ex;
                    }
                    LOGGER.info("{} and {} are on different filesystems, falling back to symlink", path, masterPath);
                    applied = Action.SYMLINK;
                    fallback = true;
                    createLink(Action.SYMLINK, linkPath, masterPath);
                }
                linkCreated = true;
            }
            fileOperations.delete(temp);
        } catch (IOException ex) {
            String reason = "Failed to create " + applied.label() + ": " + describe(ex);
            String rollbackProblem = rollback(temp, path, linkCreated ? linkPath : null);
            if (rollbackProblem != null) {
                reason = reason + "; " + rollbackProblem;
            }
            return fallback ? ActionOutcome.failedFallback(reason) : ActionOutcome.failed(applied, reason);
        }

        LOGGER.debug("{} {} -> {}", applied.label(), path, masterPath);
        return fallback ? ActionOutcome.succeededWithFallback(size) : ActionOutcome.succeeded(applied, size);
    }

    /**
     * Checks the master is still present with its scanned content. Returns the reason to skip its group, if any.
     */
    public Optional<String> verifyMaster(FileRecord master, String expectedHash) {
        if (!fileOperations.exists(master.path())) {
            return Optional.of("master missing");
        }
        try {
            if (!hasher.hash(master.path(), algorithm, fastMode).equals(expectedHash)) {
                return Optional.of("master content changed since scan");
            }
        } catch (ScanException ex) {
            return Optional.of("master unreadable: " + ex.getCause().getMessage());
        }
        return Optional.empty();
    }

    private void createLink(Action action, Path linkPath, Path masterPath) throws IOException {
        switch (action) {
            case HARDLINK -> fileOperations.createLink(linkPath, masterPath);
            case SYMLINK -> fileOperations.createSymbolicLink(linkPath, masterPath.toAbsolutePath());
            case DELETE, COMPARE -> throw new IllegalStateException("Action " + action.label() + " creates no link.");
        }
    }

    /**
     * Restores the staged duplicate. Returns a description of what went wrong, or {@code null} on success.
     */
    private String rollback(Path temp, Path original, Path createdLink) {
        if (createdLink != null) {
            try {
                fileOperations.delete(createdLink);
            } catch (IOException ex) {
                LOGGER.error("Rollback could not remove link {}; original content kept at {}", createdLink, temp, ex);
                return "rollback failed, original content kept at " + temp;
            }
        }
        try {
            fileOperations.move(temp, original);
            return null;
        } catch (IOException ex) {
            LOGGER.error("Rollback could not restore {} from {}", original, temp, ex);
            return "rollback failed, original content kept at " + temp;
        }
    }

    Path temporaryPathFor(Path path) {
        String name = path.getFileName().toString();
        Path candidate = path.resolveSibling(name + TEMP_SUFFIX);
        int counter = 1;
        while (fileOperations.exists(candidate)) {
            candidate = path.resolveSibling(name + TEMP_SUFFIX + "." + counter);
            counter++;
        }
        return candidate;
    }

    private static String describe(IOException ex) {
        String message = ex.getMessage();
        return message == null ? ex.getClass().getSimpleName() : message;
    }
}
