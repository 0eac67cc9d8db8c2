package com.nowa.archive.index;

/** fingerprint -> relative archive path (YYYY/MM/name) */
public record IndexedLocation(String fingerprint, String archivePath) {}
