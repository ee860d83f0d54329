package com.example.filematcher;

import com.example.filematcher.model.DuplicateGroup;
import com.example.filematcher.model.FileRecord;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiPredicate;

/**
 * Output of matching two indexes. Groups are ordered by master path.
 */
public record MatchResult(
        List<DuplicateGroup> groups,
        List<Path> unmatchedFirst,
        List<Path> unmatchedSecond,
        List<String> warnings
) {
    public MatchResult {
        groups = List.copyOf(groups);
        unmatchedFirst = List.copyOf(unmatchedFirst);
        unmatchedSecond = List.copyOf(unmatchedSecond);
        warnings = List.copyOf(warnings);
    }

    public int duplicateCount() {
        return groups.stream().mapToInt(group -> group.duplicates().size()).sum();
    }

    public long reclaimableBytes() {
        return groups.stream().mapToLong(group -> group.duplicateBytes()).sum();
    }

    /**
     * Drops the duplicates matched by {@code exclude} (given master and duplicate). Groups left without
     * duplicates are dropped as well.
     */
    public MatchResult withoutDuplicates(BiPredicate<FileRecord, FileRecord> exclude) {
        List<DuplicateGroup> kept = new ArrayList<>();
        for (DuplicateGroup group : groups) {
            List<FileRecord> duplicates = group.duplicates().stream()
                    .filter(duplicate -> !exclude.test(group.master(), duplicate))
                    .toList();
            if (!duplicates.isEmpty()) {
                kept.add(new DuplicateGroup(group.hash(), group.master(), duplicates, group.reason()));
            }
        }
        return new MatchResult(kept, unmatchedFirst, unmatchedSecond, warnings);
    }
}
