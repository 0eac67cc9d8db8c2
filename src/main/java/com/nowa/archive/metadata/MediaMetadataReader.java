package com.nowa.archive.metadata;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Codec/EXIF metadata 讀取介面。
 * ✅ 讀不到或沒有 metadata 的檔案一律回 empty，不丟例外。
 */
public interface MediaMetadataReader {

    /** EXIF DateTimeOriginal，保留相機本地時間（不轉時區） */
    Optional<LocalDateTime> readExifDate(Path file);

    /** 影片長度（秒） */
    Optional<Double> readDurationSeconds(Path file);
}
