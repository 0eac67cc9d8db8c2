package com.nowa.archive.index.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "tag", uniqueConstraints = @UniqueConstraint(name = "uk_tag_value", columnNames = "tag_value"))
public class TagEntity {

    /** 常見檔案系統的目錄名上限 255 bytes */
    public static final int MAX_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // "value" 在 H2 是保留字
    @Column(name = "tag_value", nullable = false, length = MAX_LENGTH)
    private String value;

    public TagEntity(String value) {
        this.value = value;
    }
}
