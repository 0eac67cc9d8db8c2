package com.nowa.archive.index;

import com.nowa.archive.config.ArchiveProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * session 寫入 Index 之前，先做一份帶時間戳的快照。
 * ✅ H2 {@code SCRIPT TO}：資料庫開著也能產生一致的 SQL dump；還原用 {@code RUNSCRIPT FROM}
 * ✅ 只保留最新的 {@code backup.keep} 份
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class IndexBackupService {

    static final DateTimeFormatter BACKUP_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final String PREFIX = "nowa_archive_";
    static final String SUFFIX = ".sql";

    private final JdbcTemplate jdbc;
    private final ArchiveProperties props;

    /** @return 快照檔；備份關閉（keep = 0）時回 empty */
    public Optional<Path> backup() throws IOException {
        int keep = props.getBackup().getKeep();
        if (keep <= 0) {
            log.debug("index backup disabled");
            return Optional.empty();
        }

        Path dir = props.resolvedBackupDir();
        Files.createDirectories(dir);
        Path target = dir.resolve(PREFIX + LocalDateTime.now().format(BACKUP_TS) + SUFFIX);

        jdbc.execute("SCRIPT TO '" + target.toString().replace("'", "''") + "'");
        log.info("index backup written: {}", target);

        prune(dir, keep);
        return Optional.of(target);
    }

    int prune(Path dir, int keep) throws IOException {
        List<Path> snapshots = new ArrayList<>();
        try (Stream<Path> s = Files.list(dir)) {
            s.filter(p -> {
                String name = p.getFileName().toString();
                return name.startsWith(PREFIX) && name.endsWith(SUFFIX);
            }).forEach(snapshots::add);
        }
        // 檔名帶時間戳，字串排序 = 時間排序
        snapshots.sort(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed());

        int deleted = 0;
        for (int i = keep; i < snapshots.size(); i++) {
            Files.deleteIfExists(snapshots.get(i));
            deleted++;
        }
        if (deleted > 0) log.info("old index backups removed: {}", deleted);
        return deleted;
    }
}
