package com.nowa.archive.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nowa.archive.index.MediaDetails;
import com.nowa.archive.index.MediaIndexService;
import com.nowa.archive.index.entity.MediaEntity;
import com.nowa.archive.index.entity.MediaType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Index 的 JSONL 匯出。
 * ✅ 一律整份重建，不做局部修改：先寫到旁邊的暫存檔再 move 蓋過去，讀的人只會看到舊檔或新檔
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class MetadataExporter {

    private final MediaIndexService index;
    private final ObjectMapper objectMapper;

    /** @return 寫出的筆數 */
    public int export(Path target) throws IOException {
        Path abs = target.toAbsolutePath().normalize();
        Files.createDirectories(abs.getParent());
        Path tmp = abs.resolveSibling(abs.getFileName() + ".tmp");

        List<MediaDetails> records = index.allMediaWithDetails();
        try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            for (MediaDetails d : records) {
                w.write(objectMapper.writeValueAsString(toLine(d)));
                w.write('\n');
            }
        }

        try {
            Files.move(tmp, abs, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, abs, StandardCopyOption.REPLACE_EXISTING);
        }

        log.info("metadata export done. records={}, file={}", records.size(), abs);
        return records.size();
    }

    static MetadataLine toLine(MediaDetails d) {
        MediaEntity m = d.media();
        Double duration = (m.getMediaType() == MediaType.VIDEO) ? m.getDuration() : null;
        return new MetadataLine(
                m.relativeArchivePath(),
                m.getHashSignature(),
                d.tags(),
                d.sources(),
                iso(m.getExifDate()),
                iso(m.getFileDate()),
                iso(m.getIngestedAt()),
                duration
        );
    }

    private static String iso(LocalDateTime t) {
        return t == null ? null : t.toString();
    }
}
