package com.nowa.archive.reconcile;

import com.nowa.archive.ingest.MediaFileScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 不需要資料庫的目錄 manifest：每個檔案一行 {@code relativePath,fingerprint}，
 * 讀不到時寫 {@code relativePath,ERROR: reason}。
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class HashManifestService {

    private final MediaFileScanner scanner;
    private final ParallelHashRunner runner;

    public record ManifestResult(Path output, int lines, int errors, boolean complete) {}

    public ManifestResult write(Path root, Path output) throws IOException {
        return write(root, output, ReconcileListener.NONE);
    }

    public ManifestResult write(Path root, Path output, ReconcileListener listener) throws IOException {
        Path absRoot = root.toAbsolutePath().normalize();
        MediaFileScanner.ScanResult scan = scanner.scan(absRoot);
        ParallelHashRunner.Run run = runner.run(absRoot, scan.files(), listener)
                .withFailures(ParallelHashRunner.unreadableOutcomes(absRoot, scan.unreadable()));

        List<HashOutcome> sorted = new ArrayList<>(run.outcomes());
        sorted.sort(Comparator.comparing(HashOutcome::relativePath));

        Path out = output.toAbsolutePath().normalize();
        if (out.getParent() != null) Files.createDirectories(out.getParent());

        int errors = 0;
        try (BufferedWriter w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            for (HashOutcome o : sorted) {
                w.write(o.relativePath());
                w.write(',');
                if (o.isOk()) {
                    w.write(o.fingerprint());
                } else {
                    w.write("ERROR: " + o.error());
                    errors++;
                }
                w.write('\n');
            }
        }

        if (!run.complete()) {
            log.warn("manifest is partial: {}/{} file(s) written to {}", sorted.size(), run.total(), out);
        } else {
            log.info("manifest written. lines={}, errors={}, file={}", sorted.size(), errors, out);
        }
        return new ManifestResult(out, sorted.size(), errors, run.complete());
    }
}
