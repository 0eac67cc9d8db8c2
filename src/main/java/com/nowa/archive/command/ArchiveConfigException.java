package com.nowa.archive.command;

/** 設定不可用；在動到任何檔案之前就丟出 */
public class ArchiveConfigException extends RuntimeException {

    public ArchiveConfigException(String message) {
        super(message);
    }
}
