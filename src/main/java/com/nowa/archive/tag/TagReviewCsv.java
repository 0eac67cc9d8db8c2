package com.nowa.archive.tag;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * folder,file_count,tags
 * tags 在同一個引號欄位內以逗號分隔："evt1,beach"
 */
public final class TagReviewCsv {

    private TagReviewCsv() {}

    public record Row(String folder, int fileCount, List<String> tags) {}

    public static Path write(Path csv, Map<String, Row> rowsByFolder) throws IOException {
        Path parent = csv.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        try (BufferedWriter w = Files.newBufferedWriter(csv, StandardCharsets.UTF_8)) {
            w.write("folder,file_count,tags");
            w.write("\r\n");
            for (Row row : new TreeMap<>(rowsByFolder).values()) {
                w.write(quote(row.folder()));
                w.write(',');
                w.write(Integer.toString(row.fileCount()));
                w.write(',');
                w.write(quote(String.join(",", row.tags())));
                w.write("\r\n");
            }
        }
        return csv;
    }

    /** folder -> 清理後的 tags；tags 欄位空白 = 該資料夾不要任何 tag */
    public static Map<String, List<String>> read(Path csv) throws IOException {
        Map<String, List<String>> out = new LinkedHashMap<>();
        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) continue;
            List<String> cols = splitRow(line);
            if (cols.size() < 3) {
                throw new IllegalArgumentException("TAG_CSV_BAD_ROW: line " + (i + 1) + ": " + line);
            }
            List<String> tags = new ArrayList<>();
            for (String raw : cols.get(2).split(",")) {
                String cleaned = FolderTagExtractor.clean(raw);
                if (!cleaned.isEmpty()) tags.add(cleaned);
            }
            out.put(cols.get(0), tags);
        }
        return out;
    }

    static String quote(String s) {
        if (s == null) return "";
        if (s.indexOf(',') < 0 && s.indexOf('"') < 0 && s.indexOf('\n') < 0 && s.indexOf('\r') < 0) {
            return s;
        }
        return '"' + s.replace("\"", "\"\"") + '"';
    }

    static List<String> splitRow(String line) {
        List<String> cols = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        cur.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    cur.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == ',') {
                cols.add(cur.toString());
                cur.setLength(0);
            } else {
                cur.append(c);
            }
        }
        cols.add(cur.toString());
        return cols;
    }
}
