package com.nowa.archive.reconcile;

import lombok.extern.slf4j.Slf4j;

/** 失敗即時記 log；進度大約每 10% 一行 */
@Slf4j
public class LoggingReconcileListener implements ReconcileListener {

    private int step = 1;

    @Override
    public void onStart(int total) {
        step = Math.max(1, total / 10);
        log.info("hashing {} archive file(s)", total);
    }

    @Override
    public void onOutcome(HashOutcome outcome, int done, int total) {
        if (!outcome.isOk()) {
            log.warn("hash failed. path={}, reason={}", outcome.relativePath(), outcome.error());
        }
        if (done % step == 0 || done == total) {
            log.info("hash progress {}/{}", done, total);
        }
    }

    @Override
    public void onFinish(int done, int total, boolean complete) {
        if (complete) {
            log.info("hashing finished. checked={}", done);
        } else {
            log.warn("hashing interrupted. checked={}/{}", done, total);
        }
    }
}
