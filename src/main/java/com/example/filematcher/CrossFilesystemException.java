package com.example.filematcher;

import java.nio.file.FileSystemException;

/**
 * A hard link was refused because source and target live on different filesystems.
 */
public class CrossFilesystemException extends FileSystemException {
    public CrossFilesystemException(String link, String existing, String reason) {
        super(link, existing, reason);
    }
}
