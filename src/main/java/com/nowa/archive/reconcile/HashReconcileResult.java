package com.nowa.archive.reconcile;

import java.util.List;

/**
 * archive 與 Index 的內容比對結果。
 * {@code complete} = false 代表中途被中斷：清單只涵蓋已檢查的檔案，{@code missing} 保持空白。
 */
public record HashReconcileResult(
        List<String> untracked,
        List<MovedEntry> moved,
        List<String> missing,
        List<StrayCopy> strayCopies,
        List<HashOutcome> errors,
        int checked,
        int total,
        boolean complete
) {

    /** Index 記錄在 {@code expectedPath}，實際內容在 {@code actualPath} */
    public record MovedEntry(String fingerprint, String expectedPath, String actualPath) {}

    /** Index 內容的多餘副本；紀錄位置不一定還有原檔 */
    public record StrayCopy(String fingerprint, String path, String expectedPath) {}

    public boolean isClean() {
        return complete && untracked.isEmpty() && moved.isEmpty() && missing.isEmpty()
                && strayCopies.isEmpty() && errors.isEmpty();
    }
}
