package com.nowa.archive.reconcile;

/** 進度 callback；✅ 一律在 coordinator thread 呼叫 */
public interface ReconcileListener {

    ReconcileListener NONE = new ReconcileListener() {};

    default void onStart(int total) {}

    default void onOutcome(HashOutcome outcome, int done, int total) {}

    default void onFinish(int done, int total, boolean complete) {}
}
