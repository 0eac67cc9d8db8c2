package com.nowa.archive.reconcile;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * kind,path,expected,detail
 * kinds: MISSING, UNTRACKED, MOVED, STRAY_COPY, ERROR, PARTIAL（中斷時的最後一列）
 */
public final class ReconcileReportWriter {

    private static final String HEADER = "kind,path,expected,detail";

    private ReconcileReportWriter() {}

    public static Path write(Path report, PathReconcileResult r) throws IOException {
        try (BufferedWriter w = open(report)) {
            for (String p : r.missing()) row(w, "MISSING", p, "", "");
            for (String p : r.untracked()) row(w, "UNTRACKED", p, "", "");
            for (HashOutcome e : r.unreadable()) row(w, "ERROR", e.relativePath(), "", e.error());
        }
        return report;
    }

    public static Path write(Path report, HashReconcileResult r) throws IOException {
        try (BufferedWriter w = open(report)) {
            for (String p : r.missing()) row(w, "MISSING", p, p, "");
            for (String p : r.untracked()) row(w, "UNTRACKED", p, "", "");
            for (var m : r.moved()) row(w, "MOVED", m.actualPath(), m.expectedPath(), m.fingerprint());
            for (var s : r.strayCopies()) row(w, "STRAY_COPY", s.path(), s.expectedPath(), s.fingerprint());
            for (HashOutcome e : r.errors()) row(w, "ERROR", e.relativePath(), "", e.error());
            if (!r.complete()) row(w, "PARTIAL", "", "", "checked " + r.checked() + " of " + r.total());
        }
        return report;
    }

    private static BufferedWriter open(Path report) throws IOException {
        Path parent = report.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        BufferedWriter w = Files.newBufferedWriter(report, StandardCharsets.UTF_8);
        w.write(HEADER);
        w.write('\n');
        return w;
    }

    private static void row(BufferedWriter w, String kind, String path, String expected, String detail) throws IOException {
        w.write(kind);
        w.write(',');
        w.write(quote(path));
        w.write(',');
        w.write(quote(expected));
        w.write(',');
        w.write(quote(detail));
        w.write('\n');
    }

    static String quote(String s) {
        if (s == null) return "";
        if (s.indexOf(',') < 0 && s.indexOf('"') < 0 && s.indexOf('\n') < 0) return s;
        return '"' + s.replace("\"", "\"\"") + '"';
    }
}
