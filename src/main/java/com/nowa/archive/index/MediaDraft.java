package com.nowa.archive.index;

import com.nowa.archive.index.entity.MediaEntity;
import com.nowa.archive.index.entity.MediaType;

import java.time.LocalDateTime;

/** 建立 MediaRecord 需要的欄位；id 在 insert 時產生 */
public record MediaDraft(
        String archivePath,
        String archiveFilename,
        MediaType mediaType,
        String hashSignature,
        long fileSize,
        Double duration,
        LocalDateTime exifDate,
        LocalDateTime fileDate,
        LocalDateTime ingestedAt
) {

    MediaEntity toEntity() {
        MediaEntity e = new MediaEntity();
        e.setArchivePath(archivePath);
        e.setArchiveFilename(archiveFilename);
        e.setMediaType(mediaType);
        e.setHashSignature(hashSignature);
        e.setFileSize(fileSize);
        e.setDuration(duration);
        e.setExifDate(exifDate);
        e.setFileDate(fileDate);
        e.setIngestedAt(ingestedAt);
        return e;
    }
}
