package com.nowa.archive.index.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 每個匯入過的 fingerprint 一筆。
 * ✅ first-writer-wins：位置、大小、fingerprint、日期都不可更新
 */
@Getter
@Setter
@Entity
@Table(
        name = "media",
        uniqueConstraints = @UniqueConstraint(name = "uk_media_hash", columnNames = "hash_signature"),
        indexes = @Index(name = "idx_media_location", columnList = "archive_path, archive_filename")
)
public class MediaEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 相對目錄，例如 2024/07 */
    @Column(name = "archive_path", nullable = false, updatable = false, length = 512)
    private String archivePath;

    @Column(name = "archive_filename", nullable = false, updatable = false, length = 512)
    private String archiveFilename;

    @Enumerated(EnumType.STRING)
    @Column(name = "media_type", nullable = false, updatable = false, length = 8)
    private MediaType mediaType;

    @Column(name = "hash_signature", nullable = false, updatable = false, length = 64)
    private String hashSignature;

    @Column(name = "file_size", nullable = false, updatable = false)
    private Long fileSize;

    /** 秒；只有影片有 */
    @Column(name = "duration", updatable = false)
    private Double duration;

    @Column(name = "exif_date", updatable = false)
    private LocalDateTime exifDate;

    @Column(name = "file_date", nullable = false, updatable = false)
    private LocalDateTime fileDate;

    @Column(name = "ingestion_timestamp", nullable = false, updatable = false)
    private LocalDateTime ingestedAt;

    @PrePersist
    void prePersist() {
        if (ingestedAt == null) ingestedAt = LocalDateTime.now().withNano(0);
    }

    /** archivePath/archiveFilename，一律用 / */
    public String relativeArchivePath() {
        return archivePath + "/" + archiveFilename;
    }
}
