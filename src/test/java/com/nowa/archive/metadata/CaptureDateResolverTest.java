package com.nowa.archive.metadata;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class CaptureDateResolverTest {

    private final CaptureDateResolver r = new CaptureDateResolver();

    @Test
    void exif_wins_even_when_years_apart() {
        LocalDateTime exif = LocalDateTime.of(2009, 12, 31, 23, 59, 0);
        LocalDateTime file = LocalDateTime.of(2023, 3, 1, 8, 0, 0);

        var out = r.resolve(exif, file);

        assertEquals(exif, out.placementDate());
        assertEquals(CaptureDateResolver.DateSource.EXIF, out.source());
        assertEquals("2009/12", out.archiveDirectory());
    }

    @Test
    void file_date_used_when_no_exif() {
        var out = r.resolve(null, LocalDateTime.of(2023, 3, 1, 8, 0, 0));

        assertEquals(CaptureDateResolver.DateSource.FILE_MODIFIED, out.source());
        assertEquals("2023/03", out.archiveDirectory());
    }

    @Test
    void file_date_is_mandatory() {
        assertThrows(NullPointerException.class, () -> r.resolve(LocalDateTime.now(), null));
    }
}
