package com.nowa.archive.index.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** 來源目錄；在這裡看過的所有 media 共用一筆 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "source_item", uniqueConstraints = @UniqueConstraint(name = "uk_source_item_path", columnNames = "source_path"))
public class SourceItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_path", nullable = false, length = 4096)
    private String sourcePath;

    public SourceItemEntity(String sourcePath) {
        this.sourcePath = sourcePath;
    }
}
