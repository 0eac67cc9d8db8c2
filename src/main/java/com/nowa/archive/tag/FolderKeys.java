package com.nowa.archive.tag;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * tag prompt 與 review CSV 共用的資料夾 key："label" 或 "label/sub/dir"。
 * ✅ label 預設是 ingestion root 的目錄名；兩個 root 目錄名相同時改用完整路徑
 */
public final class FolderKeys {

    private FolderKeys() {}

    /** 順序同 {@code roots}；路徑轉成絕對路徑並 normalize */
    public static Map<Path, String> rootLabels(List<Path> roots) {
        List<Path> distinct = new ArrayList<>();
        Map<String, Integer> nameCount = new HashMap<>();
        for (Path r : roots) {
            Path abs = r.toAbsolutePath().normalize();
            if (distinct.contains(abs)) continue;
            distinct.add(abs);
            nameCount.merge(name(abs), 1, Integer::sum);
        }

        Map<Path, String> labels = new LinkedHashMap<>();
        for (Path abs : distinct) {
            String name = name(abs);
            labels.put(abs, nameCount.get(name) > 1 ? slashes(abs.toString()) : name);
        }
        return labels;
    }

    public static String key(String rootLabel, Path relative) {
        String rel = slashes(relative.toString());
        return rel.isEmpty() ? rootLabel : rootLabel + "/" + rel;
    }

    /** key 對應的來源目錄；多個 label 符合時取最長的 */
    public static Optional<Path> resolve(String folderKey, Map<Path, String> rootLabels) {
        Path best = null;
        String bestLabel = "";
        for (var e : rootLabels.entrySet()) {
            String label = e.getValue();
            boolean matches = folderKey.equals(label) || folderKey.startsWith(label + "/");
            if (matches && label.length() > bestLabel.length()) {
                best = e.getKey();
                bestLabel = label;
            }
        }
        if (best == null) return Optional.empty();
        if (folderKey.length() == bestLabel.length()) return Optional.of(best);
        return Optional.of(best.resolve(folderKey.substring(bestLabel.length() + 1)).normalize());
    }

    private static String name(Path abs) {
        return abs.getFileName() == null ? slashes(abs.toString()) : abs.getFileName().toString();
    }

    private static String slashes(String s) {
        return s.replace('\\', '/');
    }
}
