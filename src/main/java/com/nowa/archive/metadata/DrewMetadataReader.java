package com.nowa.archive.metadata;

import com.drew.imaging.ImageMetadataReader;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.mov.QuickTimeDirectory;
import com.drew.metadata.mp4.Mp4Directory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * 以 metadata-extractor 實作：
 * - 照片：DateTimeOriginal "yyyy:MM:dd HH:mm:ss" (tag 0x9003)，視為相機本地時間
 * - 影片：MP4 / QuickTime header 的 mvhd duration / time scale
 *
 * movie header 直接用 tag 編號：部分 metadata-extractor 版本不是每個 directory class 都有常數。
 */
@Slf4j
@Component
public class DrewMetadataReader implements MediaMetadataReader {

    private static final DateTimeFormatter EXIF_FMT =
            DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    // mvhd atom
    private static final int TAG_TIME_SCALE = 0x0102;
    private static final int TAG_DURATION = 0x0103;

    @Override
    public Optional<LocalDateTime> readExifDate(Path file) {
        if (file == null) return Optional.empty();
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(file.toFile());
            ExifSubIFDDirectory dir = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
            if (dir == null) return Optional.empty();
            return parseExifDateTime(dir.getString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL));
        } catch (Exception e) {
            log.debug("no EXIF date: file={}, err={}", file, e.toString());
            return Optional.empty();
        }
    }

    @Override
    public Optional<Double> readDurationSeconds(Path file) {
        if (file == null) return Optional.empty();
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(file.toFile());
            for (Class<? extends Directory> type : List.of(Mp4Directory.class, QuickTimeDirectory.class)) {
                Directory dir = metadata.getFirstDirectoryOfType(type);
                Optional<Double> d = durationOf(dir);
                if (d.isPresent()) return d;
            }
            return Optional.empty();
        } catch (Exception e) {
            log.debug("no duration: file={}, err={}", file, e.toString());
            return Optional.empty();
        }
    }

    static Optional<Double> durationOf(Directory dir) {
        if (dir == null) return Optional.empty();
        Long scale = dir.getLongObject(TAG_TIME_SCALE);
        Long units = dir.getLongObject(TAG_DURATION);
        if (scale == null || units == null || scale <= 0) return Optional.empty();
        return Optional.of(units.doubleValue() / scale.doubleValue());
    }

    /** 拆出來方便單元測試（不需要真的 JPEG） */
    static Optional<LocalDateTime> parseExifDateTime(String exifDateTime) {
        if (exifDateTime == null || exifDateTime.isBlank()) return Optional.empty();
        try {
            return Optional.of(LocalDateTime.parse(exifDateTime.trim(), EXIF_FMT));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
