package com.nowa.archive.ingest.placement;

import java.util.Map;

/**
 * 單一 archive 目錄內的檔名決定（deterministic）。
 * <p>
 * {@code existingNames}：目錄中已佔用的名字（磁碟上或本 session 稍早登記）-> 持有的 fingerprint；
 * 空字串 = 擁有者未知。
 */
public final class PlacementResolver {

    static final int SUFFIX_LENGTH = 8;

    private PlacementResolver() {}

    public static String resolve(String directory,
                                 String baseName,
                                 String fingerprint,
                                 Map<String, String> existingNames) {
        String owner = existingNames.get(baseName);
        if (owner == null || owner.equals(fingerprint)) {
            return baseName;
        }

        String suffixed = suffixedName(baseName, fingerprint);
        String suffixedOwner = existingNames.get(suffixed);
        if (suffixedOwner == null || suffixedOwner.equals(fingerprint)) {
            return suffixed;
        }
        throw new PlacementCollisionException(directory, suffixed, fingerprint);
    }

    /** IMG_0001.jpg + 3fa9c2d1... -> IMG_0001_3fa9c2d1.jpg */
    public static String suffixedName(String baseName, String fingerprint) {
        String suffix = fingerprint.substring(0, Math.min(SUFFIX_LENGTH, fingerprint.length()));
        int dot = baseName.lastIndexOf('.');
        if (dot <= 0) return baseName + "_" + suffix;
        return baseName.substring(0, dot) + "_" + suffix + baseName.substring(dot);
    }
}
