package com.example.filematcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Locale;
import java.util.Objects;

public final class NioFileOperations implements FileOperations {
    private static final Logger LOGGER = LoggerFactory.getLogger(NioFileOperations.class);

    @Override
    public boolean exists(Path path) {
        return Files.exists(path, LinkOption.NOFOLLOW_LINKS);
    }

    @Override
    public void move(Path source, Path target) throws IOException {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    }

    @Override
    public void createLink(Path link, Path existing) throws IOException {
        try {
            Files.createLink(link, existing);
        } catch (FileSystemException ex) {
            if (isCrossDevice(ex)) {
                CrossFilesystemException crossFs = new CrossFilesystemException(link.toString(), existing.toString(), ex.getReason());
                crossFs.initCause(ex);
                throw crossFs;
            }
            throw ex;
        }
    }

    @Override
    public void createSymbolicLink(Path link, Path target) throws IOException {
        Files.createSymbolicLink(link, target);
    }

    @Override
    public void delete(Path path) throws IOException {
        Files.delete(path);
    }

    @Override
    public void createDirectories(Path directory) throws IOException {
        Files.createDirectories(directory);
    }

    @Override
    public boolean isHardLinkTo(Path path, Path other) {
        try {
            BasicFileAttributes first = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            BasicFileAttributes second = Files.readAttributes(other, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            if (first.fileKey() != null && second.fileKey() != null) {
                return Objects.equals(first.fileKey(), second.fileKey());
            }
            return !first.isSymbolicLink() && Files.isSameFile(path, other);
        } catch (IOException ex) {
            LOGGER.debug("Could not compare {} and {} for hard link check", path, other, ex);
            return false;
        }
    }

    @Override
    public boolean isSymbolicLinkTo(Path path, Path target) {
        if (!Files.isSymbolicLink(path)) {
            return false;
        }
        try {
            return path.toRealPath().equals(target.toRealPath());
        } catch (IOException ex) {
            LOGGER.debug("Could not resolve symlink {} against {}", path, target, ex);
            return false;
        }
    }

    private static boolean isCrossDevice(FileSystemException ex) {
        String reason = ex.getReason();
        if (reason == null) {
            return false;
        }
        String lower = reason.toLowerCase(Locale.ROOT);
        return lower.contains("cross-device") || lower.contains("not same device") || lower.contains("different disk");
    }
}
