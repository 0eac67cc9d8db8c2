package com.nowa.archive.ingest.placement;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PlacementSessionTest {

    @TempDir
    Path archive;

    private final List<Path> hashed = new ArrayList<>();

    private PlacementSession session(Map<String, String> indexed) {
        return new PlacementSession(archive, new PlacementSession.OwnerLookup() {
            @Override
            public Optional<String> fingerprintAt(String relativeDirectory, String filename) {
                return Optional.ofNullable(indexed.get(relativeDirectory + "/" + filename));
            }

            @Override
            public String hashOccupant(Path file) {
                hashed.add(file);
                return "disk" + file.getFileName();
            }
        });
    }

    @Test
    void two_files_of_one_session_never_get_the_same_name() throws IOException {
        PlacementSession s = session(Map.of());

        assertEquals("a.jpg", s.place("2021/06", "a.jpg", "11111111xxxx"));
        assertEquals("a_22222222.jpg", s.place("2021/06", "a.jpg", "22222222xxxx"));
        // same content again in the session reuses its claim
        assertEquals("a.jpg", s.place("2021/06", "a.jpg", "11111111xxxx"));
    }

    @Test
    void existing_archive_files_are_seeded_from_index_then_from_content() throws IOException {
        Files.createDirectories(archive.resolve("2021/06"));
        Files.writeString(archive.resolve("2021/06/a.jpg"), "x");
        Files.writeString(archive.resolve("2021/06/b.jpg"), "y");

        PlacementSession s = session(Map.of("2021/06/a.jpg", "aaaaaaaa1111"));

        assertEquals("a.jpg", s.place("2021/06", "a.jpg", "aaaaaaaa1111"));
        assertEquals("b_bbbbbbbb.jpg", s.place("2021/06", "b.jpg", "bbbbbbbb2222"));
        assertEquals(List.of(archive.resolve("2021/06/b.jpg")), hashed);
    }

    @Test
    void released_name_becomes_free_again() throws IOException {
        PlacementSession s = session(Map.of());
        s.place("2022/01", "a.jpg", "11111111xxxx");
        s.release("2022/01", "a.jpg");

        assertEquals("a.jpg", s.place("2022/01", "a.jpg", "22222222xxxx"));
    }
}
