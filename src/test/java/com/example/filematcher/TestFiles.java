package com.example.filematcher;

import com.example.filematcher.model.FileRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

final class TestFiles {
    private TestFiles() {
    }

    static Path write(Path path, String content, Instant modified) throws IOException {
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
        Files.setLastModifiedTime(path, FileTime.from(modified));
        return path.toRealPath();
    }

    static FileRecord record(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        return DirectoryIndexer.recordFor(path.toRealPath(), attrs);
    }

    static boolean sameStorage(Path first, Path second) throws IOException {
        BasicFileAttributes a = Files.readAttributes(first, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        BasicFileAttributes b = Files.readAttributes(second, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        return !a.isSymbolicLink() && !b.isSymbolicLink() && a.fileKey() != null && a.fileKey().equals(b.fileKey());
    }

    static long tempFileCount(Path directory) throws IOException {
        try (var stream = Files.list(directory)) {
            return stream.filter(path -> path.getFileName().toString().contains(LinkReplacer.TEMP_SUFFIX)).count();
        }
    }
}
