package com.nowa.archive.reconcile;

import com.nowa.archive.hash.FileHasher;
import com.nowa.archive.hash.HashRetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ParallelHashRunnerTest {

    @TempDir
    Path root;

    ThreadPoolTaskExecutor executor;
    ParallelHashRunner runner;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(3);
        executor.setMaxPoolSize(3);
        executor.setThreadNamePrefix("test-hash-");
        executor.initialize();
        runner = new ParallelHashRunner(new FileHasher(HashRetryPolicy.noRetry(), d -> { }), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void every_file_yields_exactly_one_outcome_and_failures_are_values() throws Exception {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            files.add(Files.writeString(root.resolve("f" + i + ".jpg"), "content " + i));
        }
        files.add(root.resolve("vanished.jpg"));

        List<Integer> progress = new ArrayList<>();
        ParallelHashRunner.Run run = runner.run(root, files, new ReconcileListener() {
            @Override
            public void onOutcome(HashOutcome outcome, int done, int total) {
                progress.add(done);
            }
        });

        assertTrue(run.complete());
        assertEquals(21, run.checked());
        assertEquals(21, progress.size());
        assertEquals(21, progress.get(20));
        assertThat(run.outcomes()).filteredOn(o -> !o.isOk())
                .singleElement()
                .satisfies(o -> {
                    assertEquals("vanished.jpg", o.relativePath());
                    assertThat(o.error()).startsWith("READ_FAILED");
                });
        assertThat(run.outcomes()).extracting(HashOutcome::relativePath).doesNotHaveDuplicates();
    }

    @Test
    void interrupted_coordinator_returns_partial_result() throws Exception {
        Path f = Files.writeString(root.resolve("a.jpg"), "a");

        Thread.currentThread().interrupt();
        ParallelHashRunner.Run run;
        try {
            run = runner.run(root, List.of(f), ReconcileListener.NONE);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }

        assertFalse(run.complete());
        assertEquals(1, run.total());
        assertEquals(0, run.checked());
    }

    @Test
    void relative_paths_use_forward_slashes() {
        assertEquals("2021/06/a.jpg", ParallelHashRunner.relativePath(root, root.resolve("2021").resolve("06").resolve("a.jpg")));
    }
}
