package com.nowa.archive.command;

import com.nowa.archive.config.ArchiveProperties;
import com.nowa.archive.index.IndexBackupService;
import com.nowa.archive.ingest.IngestionReport;
import com.nowa.archive.ingest.IngestionService;
import com.nowa.archive.reconcile.HashManifestService;
import com.nowa.archive.reconcile.HashReconcileResult;
import com.nowa.archive.reconcile.HashReconciler;
import com.nowa.archive.reconcile.LoggingReconcileListener;
import com.nowa.archive.reconcile.PathReconcileResult;
import com.nowa.archive.reconcile.PathReconciler;
import com.nowa.archive.reconcile.ReconcileReportWriter;
import com.nowa.archive.tag.TagReviewService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * context 啟動後執行 app.archive.command 指定的指令。
 * reconcile 有差異、或 manifest 有讀不到的檔案 -> exit code 1
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class ArchiveCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final DateTimeFormatter REPORT_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ArchiveProperties props;
    private final ArchivePropertiesValidator validator;
    private final IngestionService ingestionService;
    private final SessionLogWriter sessionLogWriter;
    private final PathReconciler pathReconciler;
    private final HashReconciler hashReconciler;
    private final HashManifestService manifestService;
    private final TagReviewService tagReviewService;
    private final IndexBackupService backupService;

    private volatile int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        ArchiveCommand command = ArchiveCommand.fromValue(props.getCommand());
        if (command == ArchiveCommand.NONE) {
            log.debug("no archive command configured");
            return;
        }
        validator.validate(command, props);

        log.info("command start: {}", command.value());
        if (!command.needsLock()) {
            execute(command);
            return;
        }
        try (ArchiveLock lock = ArchiveLock.acquire(props.resolvedLockFile())) {
            if (command.writesIndex()) backupService.backup();
            execute(command);
        }
    }

    void execute(ArchiveCommand command) throws Exception {
        Path root = props.archiveRoot();
        switch (command) {
            case INGEST -> {
                IngestionReport report = ingestionService.ingest();
                Path sessionLog = sessionLogWriter.write(report, props);
                log.info("session log: {}", sessionLog);
            }
            case RECONCILE_PATHS -> {
                PathReconcileResult r = pathReconciler.reconcile(root);
                Path report = ReconcileReportWriter.write(reportFile("reconcile_paths"), r);
                log.info("path reconcile report: {} (clean={})", report, r.isClean());
                if (!r.isClean()) exitCode = 1;
            }
            case RECONCILE_HASH -> {
                HashReconcileResult r = hashReconciler.reconcile(root, new LoggingReconcileListener());
                Path report = ReconcileReportWriter.write(reportFile("reconcile_hash"), r);
                log.info("hash reconcile report: {} (clean={})", report, r.isClean());
                if (!r.isClean()) exitCode = 1;
            }
            case HASH_MANIFEST -> {
                HashManifestService.ManifestResult r =
                        manifestService.write(root, props.getManifestOutput(), new LoggingReconcileListener());
                if (r.errors() > 0 || !r.complete()) exitCode = 1;
            }
            case APPLY_TAGS -> tagReviewService.apply(props.getTagReviewCsv());
            default -> throw new IllegalStateException("UNHANDLED_COMMAND: " + command);
        }
    }

    private Path reportFile(String prefix) {
        return props.resolvedLogDir().resolve(prefix + "_" + LocalDateTime.now().format(REPORT_TS) + ".csv");
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
