package com.nowa.archive.ingest.placement;

/**
 * 原檔名與加 fingerprint 後綴的名字都被其他內容佔用。
 * session 內無法恢復，整次執行中止。
 */
public class PlacementCollisionException extends RuntimeException {

    private final String directory;
    private final String candidate;
    private final String fingerprint;

    public PlacementCollisionException(String directory, String candidate, String fingerprint) {
        super("PLACEMENT_COLLISION: " + directory + "/" + candidate
                + " is held by different content (incoming fingerprint " + fingerprint + ")");
        this.directory = directory;
        this.candidate = candidate;
        this.fingerprint = fingerprint;
    }

    public String directory() { return directory; }
    public String candidate() { return candidate; }
    public String fingerprint() { return fingerprint; }
}
