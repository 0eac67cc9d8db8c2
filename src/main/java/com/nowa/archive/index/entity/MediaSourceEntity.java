package com.nowa.archive.index.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.Serializable;

/**
 * (media, directory, filename)：檔名也是 key 的一部分，
 * 同一資料夾內兩個不同名字的副本都會保留。
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Entity
@IdClass(MediaSourceEntity.Key.class)
@Table(
        name = "media_source",
        indexes = {
                @Index(name = "idx_media_source_media", columnList = "media_id"),
                @Index(name = "idx_media_source_source", columnList = "source_item_id")
        }
)
public class MediaSourceEntity {

    @Id
    @Column(name = "media_id", nullable = false)
    private Long mediaId;

    @Id
    @Column(name = "source_item_id", nullable = false)
    private Long sourceItemId;

    @Id
    @Column(name = "source_filename", nullable = false, length = 512)
    private String sourceFilename;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private Long mediaId;
        private Long sourceItemId;
        private String sourceFilename;
    }
}
