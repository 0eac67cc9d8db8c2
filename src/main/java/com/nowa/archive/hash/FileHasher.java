package com.nowa.archive.hash;

import com.nowa.archive.config.ArchiveProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;

/**
 * 只對檔案內容做 SHA-256（檔名、時間、權限都不進 digest）。
 * ✅ thread-safe：每次呼叫自己建 MessageDigest，reconcile 的 worker 可以共用同一個 instance
 */
@Slf4j
@Component
public class FileHasher {

    static final int CHUNK_SIZE = 64 * 1024;

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration d) throws InterruptedException;
    }

    private final HashRetryPolicy policy;
    private final Sleeper sleeper;

    @Autowired
    public FileHasher(ArchiveProperties props) {
        this(new HashRetryPolicy(
                props.getHash().getMaxAttempts(),
                props.getHash().getInitialBackoff(),
                props.getHash().getMaxBackoff()
        ), d -> Thread.sleep(d.toMillis()));
    }

    public FileHasher(HashRetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public HashRetryPolicy policy() {
        return policy;
    }

    /** 單次讀取，不重試 */
    public String hash(Path path) throws IOException {
        MessageDigest md = sha256();
        try (InputStream in = Files.newInputStream(path);
             DigestInputStream din = new DigestInputStream(in, md)) {
            byte[] buf = new byte[CHUNK_SIZE];
            while (din.read(buf) >= 0) {
                // digest 由 stream 邊讀邊更新
            }
        }
        return HexFormat.of().formatHex(md.digest());
    }

    /**
     * 有上限的重試 + 指數 backoff。
     *
     * @throws FileReadException 全部嘗試都失敗時；✅ 絕不回傳部分內容的 digest
     */
    public String hashWithRetry(Path path) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return hash(path);
            } catch (IOException e) {
                if (policy.shouldGiveUp(attempt)) {
                    throw new FileReadException(path, attempt, e);
                }
                Duration delay = policy.delayAfter(attempt);
                log.info("retrying failed file read {} (attempt {}/{}) in {}ms: {}",
                        path, attempt + 1, policy.maxAttempts(), delay.toMillis(), e.toString());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new FileReadException(path, attempt, ie);
                }
            }
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
