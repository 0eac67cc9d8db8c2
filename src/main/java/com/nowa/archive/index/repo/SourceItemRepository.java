package com.nowa.archive.index.repo;

import com.nowa.archive.index.entity.SourceItemEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SourceItemRepository extends JpaRepository<SourceItemEntity, Long> {

    Optional<SourceItemEntity> findBySourcePath(String sourcePath);
}
