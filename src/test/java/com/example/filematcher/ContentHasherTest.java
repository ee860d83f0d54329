package com.example.filematcher;

import com.example.filematcher.model.HashAlgorithm;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ContentHasherTest {
    @Test
    void hashesWithBothAlgorithms() throws Exception {
        Path file = Files.createTempDirectory("hasher-test").resolve("hello.txt");
        Files.writeString(file, "hello");

        ContentHasher hasher = new ContentHasher();

        assertEquals("5d41402abc4b2a76b9719d911017c592", hasher.hash(file, HashAlgorithm.MD5, false));
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824",
                hasher.hash(file, HashAlgorithm.SHA256, false));
    }

    @Test
    void fastModeOnlySamplesLargeFiles() throws Exception {
        Path dir = Files.createTempDirectory("hasher-fast");
        byte[] content = new byte[4000];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) (i % 251);
        }
        byte[] altered = content.clone();
        // Offset 500 lies between the start and 25% samples.
        altered[500] = (byte) (altered[500] + 1);
        Path first = Files.write(dir.resolve("first.bin"), content);
        Path second = Files.write(dir.resolve("second.bin"), altered);

        ContentHasher hasher = new ContentHasher(1000, 10);

        assertEquals(hasher.hash(first, HashAlgorithm.MD5, true), hasher.hash(second, HashAlgorithm.MD5, true));
        assertNotEquals(hasher.hash(first, HashAlgorithm.MD5, false), hasher.hash(second, HashAlgorithm.MD5, false));
    }

    @Test
    void fastModeStillSeesSampledBytesAndSize() throws Exception {
        Path dir = Files.createTempDirectory("hasher-fast-diff");
        byte[] content = new byte[4000];
        byte[] alteredStart = content.clone();
        alteredStart[3] = 7;
        Path first = Files.write(dir.resolve("first.bin"), content);
        Path second = Files.write(dir.resolve("second.bin"), alteredStart);
        Path longer = Files.write(dir.resolve("longer.bin"), new byte[4001]);

        ContentHasher hasher = new ContentHasher(1000, 10);

        assertNotEquals(hasher.hash(first, HashAlgorithm.MD5, true), hasher.hash(second, HashAlgorithm.MD5, true));
        assertNotEquals(hasher.hash(first, HashAlgorithm.MD5, true), hasher.hash(longer, HashAlgorithm.MD5, true));
    }

    @Test
    void smallFilesIgnoreFastMode() throws Exception {
        Path file = Files.createTempDirectory("hasher-small").resolve("small.txt");
        Files.writeString(file, "hello");

        ContentHasher hasher = new ContentHasher(1000, 10);

        assertEquals(hasher.hash(file, HashAlgorithm.MD5, false), hasher.hash(file, HashAlgorithm.MD5, true));
    }

    @Test
    void missingFileIsScanError() throws Exception {
        Path missing = Files.createTempDirectory("hasher-missing").resolve("nope.txt");

        ScanException ex = assertThrows(ScanException.class,
                () -> new ContentHasher().hash(missing, HashAlgorithm.SHA256, false));
        assertEquals(missing, ex.getPath());
    }
}
