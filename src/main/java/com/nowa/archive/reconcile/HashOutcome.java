package com.nowa.archive.reconcile;

/**
 * worker hash 單一檔案的結果：fingerprint，或拿不到的原因。
 * ✅ 以值回傳，不跨 pool 丟例外
 */
public record HashOutcome(String relativePath, String fingerprint, String error) {

    public static HashOutcome ok(String relativePath, String fingerprint) {
        return new HashOutcome(relativePath, fingerprint, null);
    }

    public static HashOutcome failed(String relativePath, String error) {
        return new HashOutcome(relativePath, null, error);
    }

    public boolean isOk() {
        return fingerprint != null;
    }
}
