package com.nowa.archive.ingest;

import com.nowa.archive.index.entity.MediaType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * 遞迴找出 root 底下支援的媒體檔。
 * 隱藏檔與隱藏目錄（. 開頭）略過；結果依路徑排序。
 * ✅ root 底下打不開的項目記為 unreadable，walk 繼續，不中斷整個 root
 */
@Slf4j
@Component
public class MediaFileScanner {

    public record Unreadable(Path path, String reason) {}

    public record ScanResult(List<Path> files, List<Unreadable> unreadable) {}

    /**
     * @throws IOException 只有 root 本身無法 walk 時
     */
    public ScanResult scan(Path root) throws IOException {
        Collector collector = new Collector(root.toAbsolutePath().normalize());
        Files.walkFileTree(collector.start, collector);
        return collector.result();
    }

    static boolean isHidden(Path p) {
        Path name = p.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    static final class Collector extends SimpleFileVisitor<Path> {

        final Path start;
        private final List<Path> files = new ArrayList<>();
        private final List<Unreadable> unreadable = new ArrayList<>();

        Collector(Path start) {
            this.start = start;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(start) && isHidden(dir)) return FileVisitResult.SKIP_SUBTREE;
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && !isHidden(file)
                    && MediaType.isSupported(file.getFileName().toString())) {
                files.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(start)) throw exc;
            if (isHidden(file)) return FileVisitResult.CONTINUE;
            log.warn("scan: cannot open {}, skipped. reason={}", file, exc.toString());
            unreadable.add(new Unreadable(file, exc.toString()));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
            if (exc == null) return FileVisitResult.CONTINUE;
            if (dir.equals(start)) throw exc;
            log.warn("scan: listing of {} aborted, rest of it skipped. reason={}", dir, exc.toString());
            unreadable.add(new Unreadable(dir, exc.toString()));
            return FileVisitResult.CONTINUE;
        }

        ScanResult result() {
            List<Path> sortedFiles = new ArrayList<>(files);
            sortedFiles.sort(null);
            List<Unreadable> sortedUnreadable = new ArrayList<>(unreadable);
            sortedUnreadable.sort((a, b) -> a.path().compareTo(b.path()));
            return new ScanResult(sortedFiles, sortedUnreadable);
        }
    }
}
