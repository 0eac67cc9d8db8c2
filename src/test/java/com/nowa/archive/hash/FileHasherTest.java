package com.nowa.archive.hash;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class FileHasherTest {

    @TempDir
    Path tempDir;

    private final List<Duration> sleeps = new ArrayList<>();

    private FileHasher hasher(int maxAttempts) {
        return new FileHasher(
                new HashRetryPolicy(maxAttempts, Duration.ofMillis(10), Duration.ofSeconds(1)),
                sleeps::add
        );
    }

    @Test
    void hash_is_lowercase_sha256_of_content() throws Exception {
        Path f = Files.writeString(tempDir.resolve("abc.jpg"), "abc", StandardCharsets.UTF_8);

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", hasher(1).hash(f));
    }

    @Test
    void hash_ignores_name_and_location() throws Exception {
        Path a = Files.writeString(tempDir.resolve("a.jpg"), "same bytes");
        Files.createDirectories(tempDir.resolve("sub"));
        Path b = Files.writeString(tempDir.resolve("sub/other-name.png"), "same bytes");

        FileHasher h = hasher(1);
        assertEquals(h.hash(a), h.hash(b));
    }

    @Test
    void hash_spans_multiple_chunks() throws Exception {
        byte[] big = new byte[FileHasher.CHUNK_SIZE * 3 + 17];
        for (int i = 0; i < big.length; i++) big[i] = (byte) i;
        Path f = Files.write(tempDir.resolve("big.mov"), big);

        byte[] changed = big.clone();
        changed[changed.length - 1] ^= 1;
        Path g = Files.write(tempDir.resolve("big2.mov"), changed);

        FileHasher h = hasher(1);
        assertThat(h.hash(f)).hasSize(64).isNotEqualTo(h.hash(g));
    }

    @Test
    void transient_failure_is_retried_then_succeeds() throws Exception {
        Path f = Files.writeString(tempDir.resolve("flaky.jpg"), "abc");
        FileHasher h = Mockito.spy(hasher(6));
        doThrow(new IOException("device busy"))
                .doThrow(new IOException("device busy"))
                .doCallRealMethod()
                .when(h).hash(f);

        String fp = h.hashWithRetry(f);

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", fp);
        verify(h, times(3)).hash(f);
        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), sleeps);
    }

    @Test
    void exhausted_retries_raise_read_error_with_attempt_count() {
        Path missing = tempDir.resolve("gone.jpg");

        FileReadException ex = assertThrows(FileReadException.class, () -> hasher(3).hashWithRetry(missing));

        assertEquals(3, ex.attempts());
        assertEquals(missing, ex.path());
        assertThat(ex.getMessage()).startsWith("READ_FAILED");
        assertEquals(2, sleeps.size());
    }

    @Test
    void interrupt_during_backoff_aborts_and_keeps_flag() {
        Path missing = tempDir.resolve("gone.jpg");
        FileHasher h = new FileHasher(new HashRetryPolicy(5, Duration.ofMillis(10), Duration.ofSeconds(1)),
                d -> { throw new InterruptedException("stop"); });

        try {
            FileReadException ex = assertThrows(FileReadException.class, () -> h.hashWithRetry(missing));
            assertEquals(1, ex.attempts());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
