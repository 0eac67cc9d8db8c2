package com.nowa.archive.command;

import com.nowa.archive.config.ArchiveProperties;
import com.nowa.archive.ingest.IngestionReport;
import com.nowa.archive.ingest.SessionStats;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/** 每次匯入一份純文字紀錄：logDir/session_yyyyMMdd_HHmmss.txt */
@Component
public class SessionLogWriter {

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    public Path write(IngestionReport report, ArchiveProperties props) throws IOException {
        Path dir = props.resolvedLogDir();
        Files.createDirectories(dir);
        Path file = dir.resolve("session_" + report.startedAt().format(FILE_TS) + ".txt");

        SessionStats s = report.stats();
        List<String> lines = new ArrayList<>();
        lines.add("Nowa Archive Ingestion Session");
        lines.add("Timestamp: " + report.startedAt());
        lines.add("Sources: " + props.getIngestionPaths().stream().map(Path::toString).collect(Collectors.joining(", ")));
        lines.add("Archive: " + props.archiveRoot());
        lines.add("Mode: " + props.getMode().name().toLowerCase(Locale.ROOT));
        lines.add("");
        lines.add("Session Summary:");
        lines.add("  Imported: " + s.getImported());
        lines.add("  Duplicates skipped: " + s.getDuplicates());
        lines.add("  Tags added: " + s.getTagsAdded());
        lines.add("  Errors: " + s.getErrors());
        if (!s.getErrorDetails().isEmpty()) {
            lines.add("");
            lines.add("Errors:");
            for (String d : s.getErrorDetails()) lines.add("  - " + d);
        }
        if (report.tagReviewCsv() != null) {
            lines.add("");
            lines.add("Tag review: " + report.tagReviewCsv());
        }

        Files.write(file, lines, StandardCharsets.UTF_8);
        return file;
    }
}
