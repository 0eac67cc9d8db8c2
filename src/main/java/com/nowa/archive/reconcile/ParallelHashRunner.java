package com.nowa.archive.reconcile;

import com.nowa.archive.hash.FileHasher;
import com.nowa.archive.hash.FileReadException;
import com.nowa.archive.ingest.MediaFileScanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;

/**
 * 把 hash 工作分給 worker pool，依完成順序收結果。
 * ✅ worker 只共用唯讀的檔案清單與（無狀態的）hasher
 * ✅ 呼叫端 thread 是唯一的 consumer，也是唯一碰結果清單的 thread
 */
@Slf4j
@Component
public class ParallelHashRunner {

    private final FileHasher hasher;
    private final ThreadPoolTaskExecutor executor;

    public ParallelHashRunner(FileHasher hasher,
                              @Qualifier("hashWorkerExecutor") ThreadPoolTaskExecutor executor) {
        this.hasher = hasher;
        this.executor = executor;
    }

    public record Run(List<HashOutcome> outcomes, int total, boolean complete) {
        public int checked() {
            return outcomes.size();
        }

        /** 加上 pool 以外發現的失敗，例如 scan 打不開的目錄 */
        public Run withFailures(List<HashOutcome> failures) {
            if (failures.isEmpty()) return this;
            List<HashOutcome> all = new ArrayList<>(outcomes);
            all.addAll(failures);
            return new Run(all, total + failures.size(), complete);
        }
    }

    public static List<HashOutcome> unreadableOutcomes(Path root, List<MediaFileScanner.Unreadable> unreadable) {
        List<HashOutcome> out = new ArrayList<>(unreadable.size());
        for (MediaFileScanner.Unreadable u : unreadable) {
            out.add(HashOutcome.failed(relativePath(root, u.path()), "UNREADABLE: " + u.reason()));
        }
        return out;
    }

    public Run run(Path root, List<Path> files, ReconcileListener listener) {
        int total = files.size();
        listener.onStart(total);

        CompletionService<HashOutcome> completion = new ExecutorCompletionService<>(executor);
        List<Future<HashOutcome>> futures = new ArrayList<>(total);
        for (Path file : files) {
            String rel = relativePath(root, file);
            futures.add(completion.submit(() -> hashOne(file, rel)));
        }

        List<HashOutcome> outcomes = new ArrayList<>(total);
        try {
            for (int i = 0; i < total; i++) {
                HashOutcome outcome = completion.take().get();
                outcomes.add(outcome);
                listener.onOutcome(outcome, outcomes.size(), total);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            log.warn("hash run interrupted after {}/{} file(s), pending work cancelled", outcomes.size(), total);
            listener.onFinish(outcomes.size(), total, false);
            return new Run(outcomes, total, false);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("HASH_WORKER_FAILED: " + e.getCause(), e.getCause());
        }

        listener.onFinish(outcomes.size(), total, true);
        return new Run(outcomes, total, true);
    }

    private HashOutcome hashOne(Path file, String rel) {
        try {
            return HashOutcome.ok(rel, hasher.hashWithRetry(file));
        } catch (FileReadException e) {
            return HashOutcome.failed(rel, e.getMessage());
        } catch (RuntimeException e) {
            return HashOutcome.failed(rel, e.toString());
        }
    }

    /** 不分平台一律用 / */
    public static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
