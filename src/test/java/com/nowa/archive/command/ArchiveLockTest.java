package com.nowa.archive.command;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ArchiveLockTest {

    @TempDir
    Path tmp;

    @Test
    void second_session_on_same_archive_is_refused_until_release() throws Exception {
        Path lockFile = tmp.resolve("archive/data/.session.lock");

        try (ArchiveLock first = ArchiveLock.acquire(lockFile)) {
            assertTrue(Files.exists(first.lockFile()));
            IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ArchiveLock.acquire(lockFile));
            assertThat(ex.getMessage()).startsWith("ARCHIVE_LOCKED");
        }

        try (ArchiveLock again = ArchiveLock.acquire(lockFile)) {
            assertEquals(lockFile, again.lockFile());
        }
    }
}
