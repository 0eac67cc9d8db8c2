package com.nowa.archive.hash;

import java.nio.file.Path;

/**
 * 重試用完仍讀不到檔案。只影響單一檔案：記錄後繼續下一個。
 */
public class FileReadException extends RuntimeException {

    private final Path path;
    private final int attempts;

    public FileReadException(Path path, int attempts, Throwable cause) {
        super("READ_FAILED: " + path + " after " + attempts + " attempt(s)"
                + (cause == null ? "" : ": " + cause), cause);
        this.path = path;
        this.attempts = attempts;
    }

    public Path path() { return path; }
    public int attempts() { return attempts; }
}
