package com.nowa.archive.command;

import com.nowa.archive.config.ArchiveProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 依指令檢查 app.archive.*。✅ 所有問題收集成一則訊息一次回報
 */
@Component
public class ArchivePropertiesValidator {

    public void validate(ArchiveCommand command, ArchiveProperties props) {
        List<String> problems = new ArrayList<>();

        if (props.getArchivePath() == null) {
            problems.add("app.archive.archive-path is required");
        }
        if (props.getHash().getMaxAttempts() < 1) {
            problems.add("app.archive.hash.max-attempts must be >= 1");
        }
        if (props.getHash().getInitialBackoff().isNegative() || props.getHash().getMaxBackoff().isNegative()) {
            problems.add("app.archive.hash backoff durations must not be negative");
        }
        if (props.getReconcile().getWorkers() < 1) {
            problems.add("app.archive.reconcile.workers must be >= 1");
        }
        if (props.getBackup().getKeep() < 0) {
            problems.add("app.archive.backup.keep must be >= 0");
        }

        switch (command) {
            case INGEST -> checkIngestionPaths(props, problems);
            case APPLY_TAGS -> {
                Path csv = props.getTagReviewCsv();
                if (csv == null) {
                    problems.add("app.archive.tag-review-csv is required for apply-tags");
                } else if (!Files.isRegularFile(csv)) {
                    problems.add("tag review csv not found: " + csv);
                }
            }
            case RECONCILE_PATHS, RECONCILE_HASH, HASH_MANIFEST -> {
                if (props.getArchivePath() != null && !Files.isDirectory(props.getArchivePath())) {
                    problems.add("archive path is not a directory: " + props.getArchivePath());
                }
            }
            default -> { }
        }

        if (!problems.isEmpty()) {
            throw new ArchiveConfigException("INVALID_CONFIG: " + String.join("; ", problems));
        }
    }

    private static void checkIngestionPaths(ArchiveProperties props, List<String> problems) {
        if (props.getIngestionPaths() == null || props.getIngestionPaths().isEmpty()) {
            problems.add("app.archive.ingestion-paths must list at least one directory");
            return;
        }
        Path archive = props.archiveRoot();
        for (Path p : props.getIngestionPaths()) {
            if (!Files.isDirectory(p)) {
                problems.add("ingestion path is not a directory: " + p);
                continue;
            }
            Path abs = p.toAbsolutePath().normalize();
            if (archive != null && (abs.startsWith(archive) || archive.startsWith(abs))) {
                problems.add("ingestion path overlaps the archive: " + p);
            }
        }
    }
}
