package com.example.filematcher;

import com.example.filematcher.model.HashAlgorithm;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Computes content digests of files.
 *
 * <p>Fast mode applies only to files of at least {@link #FAST_MODE_THRESHOLD} bytes. It digests the file
 * size and five {@link #SAMPLE_SIZE}-byte windows (start, 25%, 50%, 75%, end) instead of the whole file.
 * Two distinct large files whose samples and sizes coincide will hash equal, so fast mode must be
 * requested explicitly and is never the default.
 */
public class ContentHasher {
    public static final long FAST_MODE_THRESHOLD = 100L * 1024 * 1024;
    public static final int SAMPLE_SIZE = 1024 * 1024;
    private static final int CHUNK_SIZE = 8192;

    private final long fastModeThreshold;
    private final int sampleSize;

    public ContentHasher() {
        this(FAST_MODE_THRESHOLD, SAMPLE_SIZE);
    }

    ContentHasher(long fastModeThreshold, int sampleSize) {
        this.fastModeThreshold = fastModeThreshold;
        this.sampleSize = sampleSize;
    }

    public String hash(Path path, HashAlgorithm algorithm, boolean fastMode) throws ScanException {
        try {
            long size = Files.size(path);
            if (fastMode && size >= fastModeThreshold) {
                return sparseHash(path, algorithm, size);
            }
            return fullHash(path, algorithm);
        } catch (IOException ex) {
            throw new ScanException(path, ex);
        }
    }

    private String fullHash(Path path, HashAlgorithm algorithm) throws IOException {
        MessageDigest digest = newDigest(algorithm);
        try (InputStream inputStream = Files.newInputStream(path)) {
            byte[] buffer = new byte[CHUNK_SIZE];
            int read;
            while ((read = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return toHex(digest.digest());
    }

    private String sparseHash(Path path, HashAlgorithm algorithm, long size) throws IOException {
        MessageDigest digest = newDigest(algorithm);
        digest.update(Long.toString(size).getBytes(StandardCharsets.UTF_8));
        long[] offsets = {
                0L,
                size / 4 - sampleSize / 2,
                size / 2 - sampleSize / 2,
                (size * 3) / 4 - sampleSize / 2,
                Math.max(0L, size - sampleSize)
        };
        try (SeekableByteChannel channel = Files.newByteChannel(path)) {
            ByteBuffer buffer = ByteBuffer.allocate(sampleSize);
            for (long offset : offsets) {
                buffer.clear();
                channel.position(Math.max(0L, offset));
                int read = 0;
                while (buffer.hasRemaining() && read != -1) {
                    read = channel.read(buffer);
                }
                buffer.flip();
                digest.update(buffer);
            }
        }
        return toHex(digest.digest());
    }

    private MessageDigest newDigest(HashAlgorithm algorithm) {
        try {
            return MessageDigest.getInstance(algorithm.jcaName());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm.jcaName() + " not available", e);
        }
    }

    private static String toHex(byte[] hash) {
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            builder.append(String.format("%02x", b));
        }
        return builder.toString();
    }
}
