package com.nowa.archive.index.repo;

import com.nowa.archive.index.entity.TagEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TagRepository extends JpaRepository<TagEntity, Long> {

    Optional<TagEntity> findByValue(String value);

    @Query("""
            select t.value from TagEntity t, MediaTagEntity mt
            where t.id = mt.tagId and mt.mediaId = :mediaId
            order by t.id
            """)
    List<String> findValuesByMediaId(@Param("mediaId") Long mediaId);
}
