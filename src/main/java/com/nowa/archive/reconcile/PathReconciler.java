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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 快速檢查：比對磁碟上的相對路徑與 Index 的 archivePath/archiveFilename。
 * 不讀內容，所以改名的檔案會變成一筆 missing + 一筆 untracked。
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class PathReconciler {

    private final MediaIndexService index;
    private final MediaFileScanner scanner;

    public PathReconcileResult reconcile(Path archiveRoot) throws IOException {
        Path root = archiveRoot.toAbsolutePath().normalize();

        MediaFileScanner.ScanResult scan = scanner.scan(root);
        Set<String> onDisk = new TreeSet<>();
        for (Path p : scan.files()) onDisk.add(ParallelHashRunner.relativePath(root, p));

        List<HashOutcome> unreadable = ParallelHashRunner.unreadableOutcomes(root, scan.unreadable());
        Set<String> unreadablePaths = new HashSet<>();
        for (HashOutcome u : unreadable) unreadablePaths.add(u.relativePath());

        Set<String> indexed = new TreeSet<>();
        for (IndexedLocation loc : index.allMediaWithLocations()) indexed.add(loc.archivePath());

        List<String> missing = new ArrayList<>();
        for (String p : indexed) {
            if (onDisk.contains(p) || HashReconciler.isUnreadable(p, unreadablePaths)) continue;
            missing.add(p);
        }

        List<String> untracked = new ArrayList<>();
        for (String p : onDisk) if (!indexed.contains(p)) untracked.add(p);

        log.info("path reconcile done. onDisk={}, indexed={}, missing={}, untracked={}, unreadable={}",
                onDisk.size(), indexed.size(), missing.size(), untracked.size(), unreadable.size());
        return new PathReconcileResult(missing, untracked, unreadable, onDisk.size());
    }
}
