package com.nowa.archive.metadata;

import com.drew.metadata.mp4.Mp4Directory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DrewMetadataReaderTest {

    @TempDir
    Path tempDir;

    private final DrewMetadataReader reader = new DrewMetadataReader();

    @Test
    void exif_datetime_format_is_parsed_as_local_time() {
        assertEquals(Optional.of(LocalDateTime.of(2019, 7, 4, 18, 2, 33)),
                DrewMetadataReader.parseExifDateTime("2019:07:04 18:02:33"));
    }

    @Test
    void blank_or_garbage_exif_value_is_empty() {
        assertTrue(DrewMetadataReader.parseExifDateTime(null).isEmpty());
        assertTrue(DrewMetadataReader.parseExifDateTime("   ").isEmpty());
        assertTrue(DrewMetadataReader.parseExifDateTime("0000:00:00 00:00:00").isEmpty());
    }

    @Test
    void unreadable_file_gives_empty_not_exception() throws Exception {
        Path fake = Files.writeString(tempDir.resolve("not-really.jpg"), "plain text");

        assertTrue(reader.readExifDate(fake).isEmpty());
        assertTrue(reader.readDurationSeconds(fake).isEmpty());
    }

    @Test
    void duration_is_units_over_time_scale() {
        Mp4Directory dir = new Mp4Directory();
        dir.setLong(0x0102, 600L);
        dir.setLong(0x0103, 7500L);

        assertEquals(Optional.of(12.5), DrewMetadataReader.durationOf(dir));
    }

    @Test
    void duration_without_time_scale_is_empty() {
        Mp4Directory dir = new Mp4Directory();
        dir.setLong(0x0103, 7500L);

        assertTrue(DrewMetadataReader.durationOf(dir).isEmpty());
        assertTrue(DrewMetadataReader.durationOf(null).isEmpty());
    }
}
