package com.nowa.archive.index;

import java.nio.file.Path;

/** 觀察到存放某 fingerprint 內容的 (directory, filename) */
public record SourceLocation(String directory, String filename) {

    public static SourceLocation of(Path file) {
        Path abs = file.toAbsolutePath().normalize();
        return new SourceLocation(abs.getParent().toString(), abs.getFileName().toString());
    }

    public String fullPath() {
        return directory + "/" + filename;
    }
}
