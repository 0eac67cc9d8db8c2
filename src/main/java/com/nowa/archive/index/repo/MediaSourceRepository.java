package com.nowa.archive.index.repo;

import com.nowa.archive.index.entity.MediaSourceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MediaSourceRepository extends JpaRepository<MediaSourceEntity, MediaSourceEntity.Key> {

    boolean existsByMediaIdAndSourceItemIdAndSourceFilename(Long mediaId, Long sourceItemId, String sourceFilename);

    long countByMediaId(Long mediaId);

    /** [sourcePath, sourceFilename] */
    @Query("""
            select si.sourcePath, ms.sourceFilename from MediaSourceEntity ms, SourceItemEntity si
            where ms.sourceItemId = si.id and ms.mediaId = :mediaId
            order by ms.sourceItemId, ms.sourceFilename
            """)
    List<Object[]> findSourcesByMediaId(@Param("mediaId") Long mediaId);
}
