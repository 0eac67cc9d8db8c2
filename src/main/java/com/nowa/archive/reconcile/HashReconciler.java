package com.nowa.archive.reconcile;

import com.nowa.archive.index.IndexedLocation;
import com.nowa.archive.index.MediaIndexService;
import com.nowa.archive.ingest.MediaFileScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 平行重新 hash 所有 archive 檔案，與 Index 的 fingerprint 比對。
 * ✅ 全部結果到齊後才分類，與完成順序無關
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class HashReconciler {

    private final MediaIndexService index;
    private final MediaFileScanner scanner;
    private final ParallelHashRunner runner;

    public HashReconcileResult reconcile(Path archiveRoot) throws IOException {
        return reconcile(archiveRoot, ReconcileListener.NONE);
    }

    public HashReconcileResult reconcile(Path archiveRoot, ReconcileListener listener) throws IOException {
        Path root = archiveRoot.toAbsolutePath().normalize();
        MediaFileScanner.ScanResult scan = scanner.scan(root);
        ParallelHashRunner.Run run = runner.run(root, scan.files(), listener)
                .withFailures(ParallelHashRunner.unreadableOutcomes(root, scan.unreadable()));

        Map<String, String> expectedByFp = new HashMap<>();
        for (IndexedLocation loc : index.allMediaWithLocations()) {
            expectedByFp.put(loc.fingerprint(), loc.archivePath());
        }

        HashReconcileResult result = classify(run, expectedByFp);
        log.info("hash reconcile done. checked={}/{}, untracked={}, moved={}, missing={}, strayCopies={}, errors={}, complete={}",
                result.checked(), result.total(), result.untracked().size(), result.moved().size(),
                result.missing().size(), result.strayCopies().size(), result.errors().size(), result.complete());
        return result;
    }

    static HashReconcileResult classify(ParallelHashRunner.Run run, Map<String, String> expectedByFp) {
        // fingerprint -> 持有它的所有路徑（排序，輸出穩定）
        Map<String, List<String>> pathsByFp = new TreeMap<>();
        List<HashOutcome> errors = new ArrayList<>();
        Set<String> failedPaths = new HashSet<>();
        for (HashOutcome o : run.outcomes()) {
            if (o.isOk()) {
                pathsByFp.computeIfAbsent(o.fingerprint(), k -> new ArrayList<>()).add(o.relativePath());
            } else {
                errors.add(o);
                failedPaths.add(o.relativePath());
            }
        }

        List<String> untracked = new ArrayList<>();
        List<HashReconcileResult.MovedEntry> moved = new ArrayList<>();
        List<HashReconcileResult.StrayCopy> strays = new ArrayList<>();

        for (var e : pathsByFp.entrySet()) {
            String fp = e.getKey();
            List<String> paths = e.getValue();
            paths.sort(null);

            String expected = expectedByFp.get(fp);
            if (expected == null) {
                untracked.addAll(paths);
                continue;
            }

            List<String> others = new ArrayList<>(paths);
            if (!others.remove(expected) && !isUnreadable(expected, failedPaths)) {
                // 紀錄位置已沒有這份內容；第一個其他副本視為它的新位置
                moved.add(new HashReconcileResult.MovedEntry(fp, expected, others.remove(0)));
            }
            for (String p : others) strays.add(new HashReconcileResult.StrayCopy(fp, p, expected));
        }

        List<String> missing = new ArrayList<>();
        if (run.complete()) {
            for (var e : expectedByFp.entrySet()) {
                if (pathsByFp.containsKey(e.getKey())) continue;
                // 讀不到 != missing
                if (isUnreadable(e.getValue(), failedPaths)) continue;
                missing.add(e.getValue());
            }
        }

        untracked.sort(null);
        missing.sort(null);
        moved.sort(Comparator.comparing(HashReconcileResult.MovedEntry::expectedPath));
        strays.sort(Comparator.comparing(HashReconcileResult.StrayCopy::path));
        errors.sort(Comparator.comparing(HashOutcome::relativePath));

        return new HashReconcileResult(untracked, moved, missing, strays, errors,
                run.checked(), run.total(), run.complete());
    }

    /** 路徑本身 hash 失敗，或位於 scan 打不開的目錄底下 */
    static boolean isUnreadable(String path, Set<String> failedPaths) {
        if (failedPaths.contains(path)) return true;
        for (String failed : failedPaths) {
            if (path.startsWith(failed + "/")) return true;
        }
        return false;
    }
}
