package com.nowa.archive.index;

/**
 * 單一檔案的 transaction 失敗並已 rollback；Index 裡沒有這個檔案的任何資料。
 */
public class IndexWriteException extends RuntimeException {

    private final String fingerprint;

    public IndexWriteException(String fingerprint, String message, Throwable cause) {
        super(message, cause);
        this.fingerprint = fingerprint;
    }

    public String fingerprint() { return fingerprint; }
}
