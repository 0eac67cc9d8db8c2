package com.nowa.archive.index.repo;

import com.nowa.archive.index.entity.MediaEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface MediaRepository extends JpaRepository<MediaEntity, Long> {

    Optional<MediaEntity> findByHashSignature(String hashSignature);

    Optional<MediaEntity> findByArchivePathAndArchiveFilename(String archivePath, String archiveFilename);

    List<MediaEntity> findAllByOrderByIdAsc();

    @Query("select m.hashSignature from MediaEntity m")
    List<String> findAllHashSignatures();

    /** [hashSignature, archivePath, archiveFilename] */
    @Query("select m.hashSignature, m.archivePath, m.archiveFilename from MediaEntity m order by m.id")
    List<Object[]> findAllLocations();

    @Query("""
            select distinct ms.mediaId from MediaSourceEntity ms, SourceItemEntity si
            where ms.sourceItemId = si.id and si.sourcePath = :sourcePath
            order by ms.mediaId
            """)
    List<Long> findIdsBySourcePath(@Param("sourcePath") String sourcePath);
}
