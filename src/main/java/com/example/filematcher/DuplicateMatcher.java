package com.example.filematcher;

import com.example.filematcher.model.DuplicateGroup;
import com.example.filematcher.model.FileRecord;
import com.example.filematcher.model.MasterReason;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Intersects two hash indexes into duplicate groups and decides which file of each group is the master.
 */
public class DuplicateMatcher {
    // Oldest first, then smallest path so that ties resolve the same way on every run.
    private static final Comparator<FileRecord> MASTER_ORDER = Comparator
            .comparing(FileRecord::lastModifiedTime)
            .thenComparing(record -> record.path().toString());

    public record MasterSelection(FileRecord master, List<FileRecord> duplicates, MasterReason reason) {
    }

    public MatchResult findDuplicates(HashIndex first, HashIndex second, Path masterRoot, boolean differentNamesOnly) {
        Objects.requireNonNull(masterRoot, "masterRoot");
        List<DuplicateGroup> groups = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<Path> unmatchedFirst = new ArrayList<>();
        List<Path> unmatchedSecond = new ArrayList<>();

        for (String hash : first.hashes()) {
            if (!second.contains(hash)) {
                first.files(hash).forEach(record -> unmatchedFirst.add(record.path()));
                continue;
            }
            List<FileRecord> candidates = union(first.files(hash), second.files(hash));
            if (candidates.size() < 2) {
                continue;
            }
            if (differentNamesOnly && allSameName(candidates)) {
                continue;
            }
            List<Path> inMaster = candidates.stream()
                    .map(FileRecord::path)
                    .filter(path -> path.startsWith(masterRoot))
                    .toList();
            if (inMaster.size() > 1) {
                warnings.add("Multiple files in master directory have identical content: "
                        + inMaster.stream().map(Path::toString).collect(Collectors.joining(", ")));
            }
            MasterSelection selection = selectMaster(candidates, masterRoot);
            groups.add(new DuplicateGroup(hash, selection.master(), selection.duplicates(), selection.reason()));
        }
        for (String hash : second.hashes()) {
            if (!first.contains(hash)) {
                second.files(hash).forEach(record -> unmatchedSecond.add(record.path()));
            }
        }

        groups.sort(Comparator.comparing(group -> group.masterPath().toString()));
        unmatchedFirst.sort(Comparator.comparing(Path::toString));
        unmatchedSecond.sort(Comparator.comparing(Path::toString));
        return new MatchResult(groups, unmatchedFirst, unmatchedSecond, warnings);
    }

    public MasterSelection selectMaster(List<FileRecord> candidates, Path masterRoot) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("Cannot select a master from an empty candidate list.");
        }
        List<FileRecord> inMaster = candidates.stream()
                .filter(record -> masterRoot != null && record.path().startsWith(masterRoot))
                .toList();
        FileRecord master;
        MasterReason reason;
        if (!inMaster.isEmpty()) {
            master = inMaster.stream().min(MASTER_ORDER).orElseThrow();
            reason = MasterReason.IN_MASTER_DIRECTORY;
        } else {
            master = candidates.stream().min(MASTER_ORDER).orElseThrow();
            reason = MasterReason.OLDEST_FALLBACK;
        }
        List<FileRecord> duplicates = candidates.stream()
                .filter(record -> !record.path().equals(master.path()))
                .sorted(Comparator.comparing(record -> record.path().toString()))
                .toList();
        return new MasterSelection(master, duplicates, reason);
    }

    // Overlapping roots can index the same path twice.
    private List<FileRecord> union(List<FileRecord> first, List<FileRecord> second) {
        Map<Path, FileRecord> byPath = new LinkedHashMap<>();
        first.forEach(record -> byPath.putIfAbsent(record.path(), record));
        second.forEach(record -> byPath.putIfAbsent(record.path(), record));
        return new ArrayList<>(byPath.values());
    }

    private boolean allSameName(List<FileRecord> candidates) {
        Set<String> names = candidates.stream().map(FileRecord::name).collect(Collectors.toSet());
        return names.size() == 1;
    }
}
