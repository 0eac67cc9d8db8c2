package com.nowa.archive.reconcile;

import com.nowa.archive.hash.FileHasher;
import com.nowa.archive.hash.HashRetryPolicy;
import com.nowa.archive.ingest.MediaFileScanner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HashManifestServiceTest {

    @TempDir
    Path tmp;

    ThreadPoolTaskExecutor executor;
    HashManifestService manifest;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.initialize();
        FileHasher hasher = new FileHasher(HashRetryPolicy.noRetry(), d -> { });
        manifest = new HashManifestService(new MediaFileScanner(), new ParallelHashRunner(hasher, executor));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void manifest_is_sorted_one_line_per_file_and_stable_across_runs() throws Exception {
        Path root = Files.createDirectories(tmp.resolve("archive"));
        Files.createDirectories(root.resolve("2021/06"));
        Files.createDirectories(root.resolve("2020/01"));
        Files.writeString(root.resolve("2021/06/b.jpg"), "abc");
        Files.writeString(root.resolve("2020/01/z.mp4"), "abc");
        Files.writeString(root.resolve("2021/06/a.jpg"), "other");

        var r1 = manifest.write(root, tmp.resolve("m1.csv"));
        var r2 = manifest.write(root, tmp.resolve("m2.csv"));

        List<String> lines = Files.readAllLines(r1.output(), StandardCharsets.UTF_8);
        assertEquals(3, r1.lines());
        assertEquals(0, r1.errors());
        assertTrue(r1.complete());
        assertEquals("2020/01/z.mp4,ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", lines.get(0));
        assertTrue(lines.get(1).startsWith("2021/06/a.jpg,"));
        assertEquals("2021/06/b.jpg,ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", lines.get(2));
        assertEquals(lines, Files.readAllLines(r2.output(), StandardCharsets.UTF_8));
    }

    @Test
    void empty_tree_gives_empty_manifest() throws Exception {
        Path root = Files.createDirectories(tmp.resolve("empty"));

        var r = manifest.write(root, tmp.resolve("out/m.csv"));

        assertEquals(0, r.lines());
        assertEquals("", Files.readString(r.output()));
    }
}
