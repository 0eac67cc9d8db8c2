package com.nowa.archive.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * application.yml:
 * app.archive.*
 */
@ConfigurationProperties(prefix = "app.archive")
public class ArchiveProperties {

    public static final List<String> DEFAULT_TAG_STOP_WORDS = List.of(
            "backup", "photos", "images", "media", "camera",
            "dcim", "export", "downloads", "documents"
    );

    public enum TransferMode { COPY, MOVE }

    /** runner 要執行的指令；"none" = 什麼都不做（測試用） */
    private String command = "none";

    /** 要匯入的來源目錄，依列出的順序處理 */
    private List<Path> ingestionPaths = new ArrayList<>();

    /** archive 根目錄：archiveRoot/YYYY/MM/filename */
    private Path archivePath;

    /** 以下相對路徑都以 archivePath 為基準 */
    private Path metadataPath = Path.of("data/metadata.jsonl");
    private Path logDir = Path.of("logs");
    private Path lockFile = Path.of("data/.session.lock");

    private TransferMode mode = TransferMode.COPY;

    private List<String> tagStopWords = new ArrayList<>(DEFAULT_TAG_STOP_WORDS);

    /** apply-tags：編輯過的 review CSV */
    private Path tagReviewCsv;

    /** hash-manifest：輸出檔（相對於工作目錄） */
    private Path manifestOutput = Path.of("hash_manifest.csv");

    private final Hash hash = new Hash();
    private final Reconcile reconcile = new Reconcile();
    private final Backup backup = new Backup();

    public static class Hash {
        /** 每個檔案的讀取次數上限（含第一次） */
        private int maxAttempts = 6;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    }

    public static class Reconcile {
        /** hashing pool 固定寬度 */
        private int workers = 8;

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }
    }

    public static class Backup {
        /** ingest / apply-tags 之前的 Index 快照保留份數；0 = 關閉備份 */
        private int keep = 10;
        private Path dir = Path.of("data/backups");

        public int getKeep() { return keep; }
        public void setKeep(int keep) { this.keep = keep; }

        public Path getDir() { return dir; }
        public void setDir(Path dir) { this.dir = dir; }
    }

    // ===== getters/setters =====
    public String getCommand() { return command; }
    public void setCommand(String command) { this.command = command; }

    public List<Path> getIngestionPaths() { return ingestionPaths; }
    public void setIngestionPaths(List<Path> ingestionPaths) { this.ingestionPaths = ingestionPaths; }

    public Path getArchivePath() { return archivePath; }
    public void setArchivePath(Path archivePath) { this.archivePath = archivePath; }

    public Path getMetadataPath() { return metadataPath; }
    public void setMetadataPath(Path metadataPath) { this.metadataPath = metadataPath; }

    public Path getLogDir() { return logDir; }
    public void setLogDir(Path logDir) { this.logDir = logDir; }

    public Path getLockFile() { return lockFile; }
    public void setLockFile(Path lockFile) { this.lockFile = lockFile; }

    public TransferMode getMode() { return mode; }
    public void setMode(TransferMode mode) { this.mode = mode; }

    public List<String> getTagStopWords() { return tagStopWords; }
    public void setTagStopWords(List<String> tagStopWords) { this.tagStopWords = tagStopWords; }

    public Path getTagReviewCsv() { return tagReviewCsv; }
    public void setTagReviewCsv(Path tagReviewCsv) { this.tagReviewCsv = tagReviewCsv; }

    public Path getManifestOutput() { return manifestOutput; }
    public void setManifestOutput(Path manifestOutput) { this.manifestOutput = manifestOutput; }

    public Hash getHash() { return hash; }

    public Reconcile getReconcile() { return reconcile; }

    public Backup getBackup() { return backup; }

    public Path archiveRoot() {
        if (archivePath == null) return null;
        return archivePath.toAbsolutePath().normalize();
    }

    public Path resolvedMetadataPath() {
        return underArchive(metadataPath);
    }

    public Path resolvedLogDir() {
        return underArchive(logDir);
    }

    public Path resolvedLockFile() {
        return underArchive(lockFile);
    }

    public Path resolvedBackupDir() {
        return underArchive(backup.getDir());
    }

    private Path underArchive(Path p) {
        if (p.isAbsolute()) return p.normalize();
        return archiveRoot().resolve(p).normalize();
    }
}
