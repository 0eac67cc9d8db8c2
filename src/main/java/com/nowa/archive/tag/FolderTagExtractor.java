package com.nowa.archive.tag;

import com.nowa.archive.index.entity.TagEntity;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 資料夾名稱 -> tag 候選。
 * ingestion root 到檔案之間的每一層目錄都是候選；
 * stop-word 以及 archive root 本身路徑上的名字會被排除。
 */
public final class FolderTagExtractor {

    public static final String THUMBNAIL_TAG = "thumbnail";

    private static final Pattern NOT_TAG_CHAR = Pattern.compile("[^a-z0-9\\-_]");

    private final Set<String> stopWords;
    private final Set<String> archiveRootSegments;

    public FolderTagExtractor(Collection<String> stopWords, Path archiveRoot) {
        this.stopWords = new HashSet<>();
        if (stopWords != null) {
            for (String w : stopWords) {
                if (w != null) this.stopWords.add(w.toLowerCase(Locale.ROOT));
            }
        }
        this.archiveRootSegments = new HashSet<>();
        if (archiveRoot != null) {
            for (Path part : archiveRoot.toAbsolutePath().normalize()) {
                String cleaned = clean(part.toString());
                if (!cleaned.isEmpty()) archiveRootSegments.add(cleaned);
            }
        }
    }

    /**
     * @param relativeFolder 檔案所在資料夾，相對於 ingestion root（root 本身為 ""）
     */
    public List<String> extract(Path relativeFolder) {
        Set<String> tags = new LinkedHashSet<>();
        if (relativeFolder == null) return new ArrayList<>();
        for (Path part : relativeFolder) {
            String cleaned = clean(part.toString());
            if (cleaned.isEmpty()) continue;
            if (stopWords.contains(cleaned)) continue;
            if (archiveRootSegments.contains(cleaned)) continue;
            tags.add(cleaned);
        }
        return new ArrayList<>(tags);
    }

    /** 小寫、只留 [a-z0-9-_]，最長 {@link TagEntity#MAX_LENGTH} 字元 */
    public static String clean(String raw) {
        if (raw == null) return "";
        String tag = NOT_TAG_CHAR.matcher(raw.strip().toLowerCase(Locale.ROOT)).replaceAll("");
        return tag.length() > TagEntity.MAX_LENGTH ? tag.substring(0, TagEntity.MAX_LENGTH) : tag;
    }

    public static boolean looksLikeThumbnail(String sourceDirectory, String filename) {
        String dir = sourceDirectory == null ? "" : sourceDirectory.toLowerCase(Locale.ROOT);
        String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        return dir.contains("thumb") || name.contains("thumb");
    }
}
