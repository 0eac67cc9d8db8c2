package com.nowa.archive.reconcile;

import java.util.List;

/**
 * 只比位置；路徑相對於 archive root 並已排序。
 * {@code unreadable}：scan 打不開的項目；✅ 其底下的 Index 路徑不算 missing
 */
public record PathReconcileResult(List<String> missing, List<String> untracked, List<HashOutcome> unreadable, int checked) {

    public boolean isClean() {
        return missing.isEmpty() && untracked.isEmpty() && unreadable.isEmpty();
    }
}
