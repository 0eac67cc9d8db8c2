package com.nowa.archive.index.repo;

import com.nowa.archive.index.entity.MediaTagEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MediaTagRepository extends JpaRepository<MediaTagEntity, MediaTagEntity.Key> {

    boolean existsByMediaIdAndTagId(Long mediaId, Long tagId);

    long countByMediaId(Long mediaId);

    @Modifying
    @Query("delete from MediaTagEntity mt where mt.mediaId = :mediaId")
    int deleteByMediaId(@Param("mediaId") Long mediaId);
}
