package com.example.filematcher;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Real filesystem operations with optional injected failures.
 */
class ScriptedFileOperations implements FileOperations {
    private final NioFileOperations delegate = new NioFileOperations();
    IOException createLinkFailure;
    IOException createSymbolicLinkFailure;
    IOException deleteFailure;
    int moves;

    static ScriptedFileOperations crossFilesystem() {
        ScriptedFileOperations operations = new ScriptedFileOperations();
        operations.createLinkFailure = new CrossFilesystemException("link", "master", "Invalid cross-device link");
        return operations;
    }

    @Override
    public boolean exists(Path path) {
        return delegate.exists(path);
    }

    @Override
    public void move(Path source, Path target) throws IOException {
        moves++;
        delegate.move(source, target);
    }

    @Override
    public void createLink(Path link, Path existing) throws IOException {
        if (createLinkFailure != null) {
            throw createLinkFailure;
        }
        delegate.createLink(link, existing);
    }

    @Override
    public void createSymbolicLink(Path link, Path target) throws IOException {
        if (createSymbolicLinkFailure != null) {
            throw createSymbolicLinkFailure;
        }
        delegate.createSymbolicLink(link, target);
    }

    @Override
    public void delete(Path path) throws IOException {
        if (deleteFailure != null && path.getFileName().toString().contains(LinkReplacer.TEMP_SUFFIX)) {
            throw deleteFailure;
        }
        delegate.delete(path);
    }

    @Override
    public void createDirectories(Path directory) throws IOException {
        delegate.createDirectories(directory);
    }

    @Override
    public boolean isHardLinkTo(Path path, Path other) {
        return delegate.isHardLinkTo(path, other);
    }

    @Override
    public boolean isSymbolicLinkTo(Path path, Path target) {
        return delegate.isSymbolicLinkTo(path, target);
    }
}
