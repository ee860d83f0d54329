package com.example.filematcher;

import com.example.filematcher.model.FileRecord;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Content hash to files mapping for one directory tree. Immutable once built.
 */
public final class HashIndex {
    private final Path root;
    private final Map<String, List<FileRecord>> filesByHash;
    private final int skippedFiles;

    private HashIndex(Path root, Map<String, List<FileRecord>> filesByHash, int skippedFiles) {
        this.root = root;
        this.filesByHash = filesByHash;
        this.skippedFiles = skippedFiles;
    }

    public Path root() {
        return root;
    }

    public Set<String> hashes() {
        return filesByHash.keySet();
    }

    public boolean contains(String hash) {
        return filesByHash.containsKey(hash);
    }

    public List<FileRecord> files(String hash) {
        return filesByHash.getOrDefault(hash, List.of());
    }

    public int fileCount() {
        return filesByHash.values().stream().mapToInt(List::size).sum();
    }

    public int skippedFiles() {
        return skippedFiles;
    }

    static Builder builder(Path root) {
        return new Builder(root);
    }

    static final class Builder {
        private final Path root;
        private final Map<String, List<FileRecord>> filesByHash = new TreeMap<>();
        private int skippedFiles;

        private Builder(Path root) {
            this.root = root;
        }

        Builder add(String hash, FileRecord record) {
            filesByHash.computeIfAbsent(hash, ignored -> new ArrayList<>()).add(record);
            return this;
        }

        Builder skipped() {
            skippedFiles++;
            return this;
        }

        HashIndex build() {
            Map<String, List<FileRecord>> frozen = new LinkedHashMap<>();
            Comparator<FileRecord> byPath = Comparator.comparing(record -> record.path().toString());
            filesByHash.forEach((hash, records) -> {
                List<FileRecord> sorted = new ArrayList<>(records);
                sorted.sort(byPath);
                frozen.put(hash, List.copyOf(sorted));
            });
            return new HashIndex(root, Collections.unmodifiableMap(frozen), skippedFiles);
        }
    }
}
