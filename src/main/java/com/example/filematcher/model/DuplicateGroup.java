package com.example.filematcher.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Files sharing one content hash: the master that is kept and the duplicates that may be replaced.
 */
public record DuplicateGroup(
        String hash,
        FileRecord master,
        List<FileRecord> duplicates,
        MasterReason reason
) {
    public DuplicateGroup {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(master, "master");
        Objects.requireNonNull(reason, "reason");
        duplicates = List.copyOf(duplicates);
        if (duplicates.isEmpty()) {
            throw new IllegalArgumentException("A duplicate group needs at least one duplicate.");
        }
        for (FileRecord duplicate : duplicates) {
            if (duplicate.path().equals(master.path())) {
                throw new IllegalArgumentException("Master " + master.path() + " cannot be its own duplicate.");
            }
        }
    }

    public Path masterPath() {
        return master.path();
    }

    public long duplicateBytes() {
        return duplicates.stream().mapToLong(FileRecord::size).sum();
    }

    public String hashPrefix() {
        return hash.length() > 8 ? hash.substring(0, 8) : hash;
    }
}
