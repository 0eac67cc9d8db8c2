package com.nowa.archive.reconcile;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class HashReconcilerClassifyTest {

    private static ParallelHashRunner.Run run(boolean complete, HashOutcome... outcomes) {
        return new ParallelHashRunner.Run(List.of(outcomes), outcomes.length, complete);
    }

    @Test
    void clean_archive_has_no_findings() {
        var r = HashReconciler.classify(
                run(true, HashOutcome.ok("2021/06/a.jpg", "H1"), HashOutcome.ok("2021/06/b.jpg", "H2")),
                Map.of("H1", "2021/06/a.jpg", "H2", "2021/06/b.jpg"));

        assertTrue(r.isClean());
        assertEquals(2, r.checked());
    }

    @Test
    void renamed_file_is_moved_not_missing_plus_untracked() {
        var r = HashReconciler.classify(
                run(true, HashOutcome.ok("2021/06/renamed.jpg", "H1")),
                Map.of("H1", "2021/06/a.jpg"));

        assertEquals(List.of(new HashReconcileResult.MovedEntry("H1", "2021/06/a.jpg", "2021/06/renamed.jpg")), r.moved());
        assertThat(r.missing()).isEmpty();
        assertThat(r.untracked()).isEmpty();
    }

    @Test
    void result_does_not_depend_on_completion_order() {
        HashOutcome a = HashOutcome.ok("x/1.jpg", "H1");
        HashOutcome b = HashOutcome.ok("x/2.jpg", "H9");
        HashOutcome c = HashOutcome.ok("x/3.jpg", "H1");
        Map<String, String> indexed = Map.of("H1", "x/0.jpg", "H2", "x/gone.jpg");

        assertEquals(HashReconciler.classify(run(true, a, b, c), indexed),
                HashReconciler.classify(run(true, c, b, a), indexed));
    }

    @Test
    void copy_next_to_recorded_location_is_a_stray_copy() {
        var r = HashReconciler.classify(
                run(true, HashOutcome.ok("2021/06/a.jpg", "H1"), HashOutcome.ok("2022/01/a copy.jpg", "H1")),
                Map.of("H1", "2021/06/a.jpg"));

        assertThat(r.moved()).isEmpty();
        assertEquals(List.of(new HashReconcileResult.StrayCopy("H1", "2022/01/a copy.jpg", "2021/06/a.jpg")), r.strayCopies());
    }

    @Test
    void missing_untracked_and_errors() {
        var r = HashReconciler.classify(
                run(true,
                        HashOutcome.ok("2021/06/new.jpg", "H3"),
                        HashOutcome.failed("2021/06/locked.jpg", "READ_FAILED: locked")),
                Map.of("H1", "2021/06/deleted.jpg", "H2", "2021/06/locked.jpg"));

        assertEquals(List.of("2021/06/deleted.jpg"), r.missing());
        assertEquals(List.of("2021/06/new.jpg"), r.untracked());
        assertEquals(1, r.errors().size());
        assertFalse(r.isClean());
    }

    @Test
    void partial_run_reports_no_missing() {
        var r = HashReconciler.classify(
                new ParallelHashRunner.Run(List.of(HashOutcome.ok("a.jpg", "H1")), 5, false),
                Map.of("H1", "a.jpg", "H2", "b.jpg"));

        assertFalse(r.complete());
        assertThat(r.missing()).isEmpty();
        assertEquals(1, r.checked());
        assertEquals(5, r.total());
        assertFalse(r.isClean());
    }

    @Test
    void unreadable_recorded_file_with_a_readable_copy_is_an_error_plus_stray_copy_not_a_move() {
        var r = HashReconciler.classify(
                run(true,
                        HashOutcome.failed("2021/06/a.jpg", "READ_FAILED: locked"),
                        HashOutcome.ok("2021/06/copy.jpg", "H1")),
                Map.of("H1", "2021/06/a.jpg"));

        assertThat(r.moved()).isEmpty();
        assertThat(r.missing()).isEmpty();
        assertEquals(List.of(new HashReconcileResult.StrayCopy("H1", "2021/06/copy.jpg", "2021/06/a.jpg")), r.strayCopies());
        assertEquals("2021/06/a.jpg", r.errors().get(0).relativePath());
    }

    @Test
    void indexed_files_under_an_unreadable_directory_are_not_missing() {
        ParallelHashRunner.Run scanned = run(true, HashOutcome.ok("2021/06/a.jpg", "H1"))
                .withFailures(List.of(HashOutcome.failed("2022/01", "UNREADABLE: java.nio.file.AccessDeniedException")));

        var r = HashReconciler.classify(scanned, Map.of("H1", "2021/06/a.jpg", "H2", "2022/01/b.jpg", "H3", "2022/02/c.jpg"));

        assertEquals(List.of("2022/02/c.jpg"), r.missing());
        assertEquals(1, r.errors().size());
        assertEquals(2, r.total());
        assertFalse(r.isClean());
    }
}
