package com.nowa.archive.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nowa.archive.index.MediaDetails;
import com.nowa.archive.index.MediaIndexService;
import com.nowa.archive.index.entity.MediaEntity;
import com.nowa.archive.index.entity.MediaType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

class MetadataExporterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper om = new ObjectMapper();

    private static MediaEntity media(long id, MediaType type, String name, Double duration) {
        MediaEntity m = new MediaEntity();
        m.setId(id);
        m.setArchivePath("2021/06");
        m.setArchiveFilename(name);
        m.setMediaType(type);
        m.setHashSignature("fp" + id);
        m.setFileSize(10L);
        m.setDuration(duration);
        m.setExifDate(type == MediaType.PHOTO ? LocalDateTime.of(2021, 6, 15, 10, 30) : null);
        m.setFileDate(LocalDateTime.of(2021, 6, 16, 8, 0));
        m.setIngestedAt(LocalDateTime.of(2024, 1, 2, 3, 4, 5));
        return m;
    }

    @Test
    void export_writes_one_line_per_record_with_snake_case_fields() throws Exception {
        MediaIndexService index = Mockito.mock(MediaIndexService.class);
        when(index.allMediaWithDetails()).thenReturn(List.of(
                new MediaDetails(media(1, MediaType.PHOTO, "a.jpg", null), List.of("evt1", "evt2"),
                        List.of("/src/evt1/a.jpg", "/src/evt2/b.jpg")),
                new MediaDetails(media(2, MediaType.VIDEO, "clip.mp4", 12.5), List.of(), List.of("/src/clip.mp4"))
        ));

        Path target = tempDir.resolve("data/metadata.jsonl");
        int n = new MetadataExporter(index, om).export(target);

        assertEquals(2, n);
        List<String> lines = Files.readAllLines(target, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).startsWith("{\"archive_path\":\"2021/06/a.jpg\",\"hash\":\"fp1\""));

        JsonNode photo = om.readTree(lines.get(0));
        assertEquals("2021-06-15T10:30", photo.get("exif_date").asText());
        assertEquals("2024-01-02T03:04:05", photo.get("ingested_at").asText());
        assertEquals(2, photo.get("sources").size());
        assertFalse(photo.has("duration"));

        JsonNode video = om.readTree(lines.get(1));
        assertTrue(video.get("exif_date").isNull());
        assertEquals(12.5, video.get("duration").asDouble());
        assertFalse(Files.exists(tempDir.resolve("data/metadata.jsonl.tmp")));
    }

    @Test
    void export_replaces_previous_file_completely() throws Exception {
        MediaIndexService index = Mockito.mock(MediaIndexService.class);
        when(index.allMediaWithDetails()).thenReturn(List.of());

        Path target = tempDir.resolve("metadata.jsonl");
        Files.writeString(target, "{\"stale\":true}\n");

        assertEquals(0, new MetadataExporter(index, om).export(target));
        assertEquals("", Files.readString(target));
    }
}
