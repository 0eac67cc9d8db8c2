package com.nowa.archive.tag;

import com.nowa.archive.config.ArchiveProperties;
import com.nowa.archive.export.MetadataExporter;
import com.nowa.archive.index.MediaIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 套用編輯過的 tag review CSV：每一列資料夾，來源在該資料夾的 media 都改成列出的 tag。
 * ✅ 是 replace 不是 union；完成後重新匯出 export
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class TagReviewService {

    private final MediaIndexService index;
    private final MetadataExporter exporter;
    private final ArchiveProperties props;

    public record ApplyResult(int foldersApplied, int mediaUpdated, int foldersSkipped) {}

    public ApplyResult apply(Path csv) throws IOException {
        Map<String, List<String>> folderTags = TagReviewCsv.read(csv);

        Map<Path, String> rootLabels = FolderKeys.rootLabels(props.getIngestionPaths());

        int applied = 0, updated = 0, skipped = 0;
        for (var entry : folderTags.entrySet()) {
            String folder = entry.getKey();
            Optional<Path> sourceDir = FolderKeys.resolve(folder, rootLabels);
            if (sourceDir.isEmpty()) {
                log.warn("tag review: no configured ingestion path matches folder {}, skipping", folder);
                skipped++;
                continue;
            }

            List<Long> mediaIds = index.mediaIdsBySourcePath(sourceDir.get().toString());
            for (Long id : mediaIds) {
                index.replaceTags(id, entry.getValue());
                updated++;
            }
            applied++;
        }

        int exported = exporter.export(props.resolvedMetadataPath());
        log.info("tag review applied. folders={}, mediaUpdated={}, skipped={}, exported={}",
                applied, updated, skipped, exported);
        return new ApplyResult(applied, updated, skipped);
    }
}
