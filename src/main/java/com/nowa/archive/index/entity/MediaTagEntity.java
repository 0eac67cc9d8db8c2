package com.nowa.archive.index.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.Serializable;

/** 只有關聯：沒有順序、沒有權重 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Entity
@IdClass(MediaTagEntity.Key.class)
@Table(
        name = "media_tag",
        indexes = {
                @Index(name = "idx_media_tag_media", columnList = "media_id"),
                @Index(name = "idx_media_tag_tag", columnList = "tag_id")
        }
)
public class MediaTagEntity {

    @Id
    @Column(name = "media_id", nullable = false)
    private Long mediaId;

    @Id
    @Column(name = "tag_id", nullable = false)
    private Long tagId;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private Long mediaId;
        private Long tagId;
    }
}
