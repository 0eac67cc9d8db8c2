package com.nowa.archive.ingest;

import com.nowa.archive.config.ArchiveProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * placement 的實體檔案操作。✅ 所有 target 都以 archive root 解析，不能跑出 root 之外
 */
@RequiredArgsConstructor
@Service
public class ArchiveFileStore {

    private final ArchiveProperties props;

    /** relativeDirectory + filename -> archive root 底下的絕對路徑 */
    public Path resolve(String relativeDirectory, String filename) {
        Path archiveRoot = props.archiveRoot();
        Path p = archiveRoot.resolve(relativeDirectory).resolve(filename).normalize();
        if (!p.startsWith(archiveRoot)) throw new SecurityException("INVALID_ARCHIVE_PATH: " + relativeDirectory + "/" + filename);
        return p;
    }

    /** 保留時間戳複製；✅ 絕不覆蓋已存在的 target */
    public void copyInto(Path source, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
    }

    public void moveInto(Path source, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        move(source, target);
    }

    /** moveInto 的 undo：檔案移回原處 */
    public void moveBack(Path placed, Path originalLocation) throws IOException {
        Files.createDirectories(originalLocation.getParent());
        move(placed, originalLocation);
    }

    public boolean delete(Path target) throws IOException {
        return Files.deleteIfExists(target);
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            // 跨檔案系統
            Files.move(from, to);
        }
    }
}
