package com.nowa.archive.command;

import java.util.Locale;

public enum ArchiveCommand {
    NONE("none"),
    INGEST("ingest"),
    RECONCILE_PATHS("reconcile-paths"),
    RECONCILE_HASH("reconcile-hash"),
    HASH_MANIFEST("hash-manifest"),
    APPLY_TAGS("apply-tags");

    private final String value;

    ArchiveCommand(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** 會寫 Index 或 archive 目錄的指令 */
    public boolean needsLock() {
        return this != NONE && this != HASH_MANIFEST;
    }

    /** 會改動 Index 內容的指令；執行前先做快照 */
    public boolean writesIndex() {
        return this == INGEST || this == APPLY_TAGS;
    }

    public static ArchiveCommand fromValue(String raw) {
        String v = raw == null ? "none" : raw.trim().toLowerCase(Locale.ROOT);
        for (ArchiveCommand c : values()) {
            if (c.value.equals(v)) return c;
        }
        throw new ArchiveConfigException("UNKNOWN_COMMAND: " + raw);
    }
}
