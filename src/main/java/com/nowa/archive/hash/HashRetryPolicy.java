package com.nowa.archive.hash;

import java.time.Duration;

/**
 * 讀檔重試表：每個檔案最多幾次、每次之間等多久。
 * ✅ maxAttempts 包含第一次讀取，所以 maxAttempts=6 代表最多重試 5 次
 * ✅ backoff 從 initialBackoff 開始倍增（1s -> 2s -> 4s -> ...），上限 maxBackoff
 */
public record HashRetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public HashRetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (initialBackoff == null || initialBackoff.isNegative()) initialBackoff = Duration.ZERO;
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) maxBackoff = initialBackoff;
    }

    public static HashRetryPolicy noRetry() {
        return new HashRetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    /**
     * @param failedAttempt 剛失敗的是第幾次（從 1 開始）
     * @return 下一次之前要等多久
     */
    public Duration delayAfter(int failedAttempt) {
        if (initialBackoff.isZero()) return Duration.ZERO;
        int shift = Math.max(0, Math.min(failedAttempt - 1, 30));
        long millis = initialBackoff.toMillis();
        long scaled = millis << shift;
        if (scaled < millis || scaled > maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis(scaled);
    }

    public boolean shouldGiveUp(int attempts) {
        return attempts >= maxAttempts;
    }
}
