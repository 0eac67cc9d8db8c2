package com.nowa.archive.ingest.placement;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 每個 session 各自的「已佔用檔名」表（依 archive 目錄）。
 * 目錄第一次用到時從磁碟載入，之後放置的名字都登記在這裡。
 * ✅ 同一個 session 的兩個檔案不可能拿到同一個 target
 */
@Slf4j
public class PlacementSession {

    /** 既有檔名的擁有者：先查 Index，查不到再 hash 檔案本身 */
    public interface OwnerLookup {
        Optional<String> fingerprintAt(String relativeDirectory, String filename);

        String hashOccupant(Path file) throws IOException;
    }

    private final Path archiveRoot;
    private final OwnerLookup lookup;
    private final Map<String, Map<String, String>> namesByDirectory = new HashMap<>();

    public PlacementSession(Path archiveRoot, OwnerLookup lookup) {
        this.archiveRoot = archiveRoot;
        this.lookup = lookup;
    }

    /**
     * 在 {@code relativeDirectory} 為 {@code fingerprint} 選名字並登記。
     *
     * @throws PlacementCollisionException 沒有可用的名字時
     */
    public String place(String relativeDirectory, String baseName, String fingerprint) throws IOException {
        Map<String, String> names = namesIn(relativeDirectory);
        String chosen = PlacementResolver.resolve(relativeDirectory, baseName, fingerprint, names);
        names.put(chosen, fingerprint);
        return chosen;
    }

    /** 放好的檔案被撤回後，釋放登記 */
    public void release(String relativeDirectory, String filename) {
        Map<String, String> names = namesByDirectory.get(relativeDirectory);
        if (names != null) names.remove(filename);
    }

    private Map<String, String> namesIn(String relativeDirectory) throws IOException {
        Map<String, String> names = namesByDirectory.get(relativeDirectory);
        if (names != null) return names;

        names = new HashMap<>();
        Path dir = archiveRoot.resolve(relativeDirectory);
        if (Files.isDirectory(dir)) {
            try (Stream<Path> s = Files.list(dir)) {
                for (Path p : (Iterable<Path>) s::iterator) {
                    if (!Files.isRegularFile(p)) continue;
                    String name = p.getFileName().toString();
                    names.put(name, ownerOf(relativeDirectory, name, p));
                }
            }
        }
        log.debug("placement seeded {} with {} existing name(s)", relativeDirectory, names.size());
        namesByDirectory.put(relativeDirectory, names);
        return names;
    }

    private String ownerOf(String relativeDirectory, String name, Path file) {
        Optional<String> indexed = lookup.fingerprintAt(relativeDirectory, name);
        if (indexed.isPresent()) return indexed.get();
        try {
            return lookup.hashOccupant(file);
        } catch (IOException e) {
            log.warn("cannot hash archive occupant {}, treating its owner as unknown: {}", file, e.toString());
            return "";
        }
    }
}
