package com.nowa.archive.index.entity;

import java.util.Locale;
import java.util.Set;

public enum MediaType {
    PHOTO, VIDEO;

    public static final Set<String> PHOTO_EXTENSIONS = Set.of(
            ".jpg", ".jpeg", ".png", ".heic", ".tiff", ".bmp",
            ".gif", ".webp", ".nef", ".nrw"
    );

    public static final Set<String> VIDEO_EXTENSIONS = Set.of(
            ".mp4", ".mov", ".avi", ".mkv", ".wmv", ".m4v"
    );

    /** ".jpg" 格式、小寫；沒有副檔名時回 "" */
    public static String extensionOf(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        if (dot <= 0 || dot == filename.length() - 1) return "";
        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }

    public static boolean isSupported(String filename) {
        String ext = extensionOf(filename);
        return PHOTO_EXTENSIONS.contains(ext) || VIDEO_EXTENSIONS.contains(ext);
    }

    public static MediaType fromFilename(String filename) {
        return VIDEO_EXTENSIONS.contains(extensionOf(filename)) ? VIDEO : PHOTO;
    }
}
