package com.nowa.archive.command;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * archive lock file 的獨占鎖（non-blocking）。✅ 同一個 archive 同時只能有一個 session
 */
@Slf4j
public final class ArchiveLock implements AutoCloseable {

    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock lock;

    private ArchiveLock(Path lockFile, FileChannel channel, FileLock lock) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * @throws IllegalStateException 另一個 session 持有 archive 時
     */
    public static ArchiveLock acquire(Path lockFile) throws IOException {
        Files.createDirectories(lockFile.toAbsolutePath().getParent());
        FileChannel ch = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        FileLock l;
        try {
            l = ch.tryLock();
        } catch (OverlappingFileLockException e) {
            l = null;
        }
        if (l == null) {
            ch.close();
            throw new IllegalStateException("ARCHIVE_LOCKED: another session holds " + lockFile);
        }
        log.debug("archive lock acquired: {}", lockFile);
        return new ArchiveLock(lockFile, ch, l);
    }

    public Path lockFile() {
        return lockFile;
    }

    @Override
    public void close() throws IOException {
        try {
            lock.release();
        } finally {
            channel.close();
            log.debug("archive lock released: {}", lockFile);
        }
    }
}
