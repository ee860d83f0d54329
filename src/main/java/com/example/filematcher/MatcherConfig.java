package com.example.filematcher;

import com.example.filematcher.model.Action;
import com.example.filematcher.model.HashAlgorithm;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Immutable runtime settings for a match run. The first directory is the master tree.
 */
public record MatcherConfig(
        Path firstDirectory,
        Path secondDirectory,
        Action action,
        boolean execute,
        boolean assumeYes,
        boolean fallbackSymlink,
        HashAlgorithm hashAlgorithm,
        boolean fastMode,
        Optional<Path> auditLog,
        Optional<Path> targetDirectory,
        boolean differentNamesOnly,
        Optional<Path> reportFile
) {
    public boolean executesActions() {
        return execute && action.modifiesFiles();
    }

    /**
     * Settings in effect, as recorded in the audit log header.
     */
    public List<String> flags() {
        List<String> flags = new ArrayList<>();
        if (execute) {
            flags.add("execute");
        }
        if (assumeYes) {
            flags.add("assumeYes");
        }
        if (fallbackSymlink) {
            flags.add("fallbackSymlink");
        }
        if (fastMode) {
            flags.add("fastMode");
        }
        if (differentNamesOnly) {
            flags.add("differentNamesOnly");
        }
        flags.add("hashAlgorithm=" + hashAlgorithm.name().toLowerCase(Locale.ROOT));
        auditLog.ifPresent(path -> flags.add("auditLog=" + path));
        targetDirectory.ifPresent(path -> flags.add("targetDirectory=" + path));
        return List.copyOf(flags);
    }
}
