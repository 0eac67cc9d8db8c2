package com.nowa.archive.tag;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FolderKeysTest {

    private static final Path A = Path.of("/mnt/a/photos");
    private static final Path B = Path.of("/mnt/b/photos");
    private static final Path C = Path.of("/mnt/c/phone");

    @Test
    void distinct_directory_names_are_used_as_labels() {
        Map<Path, String> labels = FolderKeys.rootLabels(List.of(A, C));

        assertEquals("photos", labels.get(A));
        assertEquals("phone", labels.get(C));
        assertEquals("photos/evt1/day2", FolderKeys.key("photos", Path.of("evt1", "day2")));
        assertEquals("photos", FolderKeys.key("photos", Path.of("")));
    }

    @Test
    void clashing_directory_names_fall_back_to_the_full_path() {
        Map<Path, String> labels = FolderKeys.rootLabels(List.of(A, B, C));

        assertEquals("/mnt/a/photos", labels.get(A));
        assertEquals("/mnt/b/photos", labels.get(B));
        assertEquals("phone", labels.get(C));
    }

    @Test
    void resolve_maps_a_key_back_to_its_source_directory() {
        Map<Path, String> labels = FolderKeys.rootLabels(List.of(A, B, C));

        assertEquals(Optional.of(Path.of("/mnt/b/photos/evt1")), FolderKeys.resolve("/mnt/b/photos/evt1", labels));
        assertEquals(Optional.of(A), FolderKeys.resolve("/mnt/a/photos", labels));
        assertEquals(Optional.of(Path.of("/mnt/c/phone/x")), FolderKeys.resolve("phone/x", labels));
        assertEquals(Optional.empty(), FolderKeys.resolve("photos/evt1", labels));
        assertEquals(Optional.empty(), FolderKeys.resolve("phoneX/evt1", labels));
    }

    @Test
    void the_same_root_listed_twice_is_not_a_clash() {
        assertEquals(Map.of(A, "photos"), FolderKeys.rootLabels(List.of(A, Path.of("/mnt/a/./photos"))));
    }
}
