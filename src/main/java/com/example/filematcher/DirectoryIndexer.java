package com.example.filematcher;

import com.example.filematcher.model.FileRecord;
import com.example.filematcher.model.HashAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;

/**
 * Walks a directory tree and indexes every regular file by content hash.
 * Symbolic links are neither followed nor indexed. Unreadable entries are logged and skipped.
 */
public class DirectoryIndexer {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryIndexer.class);

    private final ContentHasher hasher;

    public DirectoryIndexer(ContentHasher hasher) {
        this.hasher = hasher;
    }

    public HashIndex index(Path root, HashAlgorithm algorithm, boolean fastMode) throws IOException {
        // Children of a real path reached without following links are canonical as well.
        Path realRoot = root.toRealPath();
        HashIndex.Builder builder = HashIndex.builder(realRoot);
        LOGGER.info("Indexing directory: {}", realRoot);

        Files.walkFileTree(realRoot, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                try {
                    String hash = hasher.hash(file, algorithm, fastMode);
                    builder.add(hash, recordFor(file, attrs));
                    LOGGER.debug("Indexed {} ({} bytes)", file, attrs.size());
                } catch (ScanException ex) {
                    LOGGER.warn("Skipping unreadable file {}: {}", file, ex.getCause().getMessage());
                    builder.skipped();
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException ex) {
                LOGGER.warn("Skipping {}: {}", file, ex.getMessage());
                builder.skipped();
                return FileVisitResult.CONTINUE;
            }
        });

        HashIndex index = builder.build();
        LOGGER.info("Completed indexing {}: {} files, {} unique contents, {} skipped",
                realRoot, index.fileCount(), index.hashes().size(), index.skippedFiles());
        return index;
    }

    static FileRecord recordFor(Path file, BasicFileAttributes attrs) {
        return new FileRecord(file, attrs.size(), attrs.lastModifiedTime().toInstant(), deviceId(file));
    }

    /**
     * Returns an identifier of the filesystem holding the path, or {@code null} if it cannot be read.
     */
    static String deviceId(Path path) {
        try {
            return String.valueOf(Files.getAttribute(path, "unix:dev", LinkOption.NOFOLLOW_LINKS));
        } catch (UnsupportedOperationException | IllegalArgumentException ex) {
            try {
                return Files.getFileStore(path).name();
            } catch (IOException storeEx) {
                LOGGER.debug("Could not determine file store for {}", path, storeEx);
                return null;
            }
        } catch (IOException ex) {
            LOGGER.debug("Could not read device id for {}", path, ex);
            return null;
        }
    }
}
