package com.nowa.archive.ingest;

import com.nowa.archive.config.ArchiveProperties;
import com.nowa.archive.export.MetadataExporter;
import com.nowa.archive.hash.FileHasher;
import com.nowa.archive.hash.FileReadException;
import com.nowa.archive.index.IndexWriteException;
import com.nowa.archive.index.MediaDraft;
import com.nowa.archive.index.MediaIndexService;
import com.nowa.archive.index.SourceLocation;
import com.nowa.archive.index.entity.MediaEntity;
import com.nowa.archive.index.entity.MediaType;
import com.nowa.archive.ingest.placement.PlacementSession;
import com.nowa.archive.metadata.CaptureDateResolver;
import com.nowa.archive.metadata.MediaMetadataReader;
import com.nowa.archive.tag.FolderKeys;
import com.nowa.archive.tag.FolderTagExtractor;
import com.nowa.archive.tag.TagPrompt;
import com.nowa.archive.tag.TagReviewCsv;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * discovery -> hash -> dedup -> place or skip -> provenance + tags -> stats.
 * <p>
 * 單執行緒。
 * ✅ 單一檔案失敗只記錄、session 繼續
 * ✅ 只有 placement collision 會中止整次執行
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class IngestionService {

    static final DateTimeFormatter SESSION_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ArchiveProperties props;
    private final MediaFileScanner scanner;
    private final FileHasher hasher;
    private final MediaIndexService index;
    private final MediaMetadataReader metadataReader;
    private final ArchiveFileStore store;
    private final TagPrompt tagPrompt;
    private final MetadataExporter exporter;

    private final CaptureDateResolver dateResolver = new CaptureDateResolver();

    public IngestionReport ingest() throws IOException {
        return ingest(props.getIngestionPaths());
    }

    public IngestionReport ingest(List<Path> ingestionRoots) throws IOException {
        LocalDateTime startedAt = LocalDateTime.now().withNano(0);
        Path archiveRoot = props.archiveRoot();
        Files.createDirectories(archiveRoot);

        Session session = new Session(
                startedAt,
                new SessionStats(),
                new PlacementSession(archiveRoot, ownerLookup()),
                new FolderTagExtractor(props.getTagStopWords(), archiveRoot),
                FolderKeys.rootLabels(ingestionRoots)
        );

        for (Path root : ingestionRoots) {
            ingestRoot(root.toAbsolutePath().normalize(), session);
        }

        Path exportFile = props.resolvedMetadataPath();
        int exported = exporter.export(exportFile);

        Path reviewCsv = null;
        if (!session.reviewRows.isEmpty()) {
            reviewCsv = exportFile.resolveSibling("tag_review_" + startedAt.format(SESSION_TS) + ".csv");
            TagReviewCsv.write(reviewCsv, session.reviewRows);
        }

        log.info("ingestion session done. {}", session.stats.summary());
        return new IngestionReport(startedAt, session.stats, exported, exportFile, reviewCsv);
    }

    private void ingestRoot(Path root, Session session) {
        MediaFileScanner.ScanResult scan;
        try {
            scan = scanner.scan(root);
        } catch (IOException e) {
            log.warn("cannot scan ingestion path {}", root, e);
            session.stats.recordError(root + ": scan failed: " + e);
            return;
        }
        for (MediaFileScanner.Unreadable u : scan.unreadable()) {
            session.stats.recordError(u.path() + ": unreadable, skipped: " + u.reason());
        }
        List<Path> files = scan.files();
        log.info("ingesting {} file(s) from {}", files.size(), root);

        Map<Path, Integer> filesPerFolder = new HashMap<>();
        for (Path f : files) filesPerFolder.merge(f.getParent(), 1, Integer::sum);

        for (Path file : files) {
            String fingerprint = null;
            try {
                fingerprint = hasher.hashWithRetry(file);
                List<String> tags = tagsFor(root, file, filesPerFolder, session);

                Optional<MediaEntity> existing = index.findByFingerprint(fingerprint);
                if (existing.isPresent()) {
                    MediaIndexService.RecordResult r = index.recordDuplicate(existing.get(), SourceLocation.of(file), tags);
                    session.stats.recordDuplicate();
                    session.stats.addTags(r.tagsAdded());
                    log.debug("duplicate {} -> {} (sourceAdded={})", file, existing.get().relativeArchivePath(), r.sourceAdded());
                } else {
                    MediaIndexService.RecordResult r = importNew(file, fingerprint, tags, session);
                    session.stats.recordImported();
                    session.stats.addTags(r.tagsAdded());
                }
            } catch (FileReadException | IndexWriteException | IOException e) {
                log.warn("ingest failed. file={}, fingerprint={}", file, fingerprint, e);
                session.stats.recordError(file + (fingerprint == null ? "" : " [" + fingerprint + "]") + ": " + e.getMessage());
            }
        }
    }

    private MediaIndexService.RecordResult importNew(Path file, String fingerprint, List<String> tags, Session session)
            throws IOException {
        LocalDateTime fileDate = LocalDateTime.ofInstant(
                Files.getLastModifiedTime(file).toInstant(), ZoneId.systemDefault()).withNano(0);
        LocalDateTime exifDate = metadataReader.readExifDate(file).orElse(null);
        String directory = dateResolver.resolve(exifDate, fileDate).archiveDirectory();

        String sourceName = file.getFileName().toString();
        MediaType type = MediaType.fromFilename(sourceName);
        Double duration = (type == MediaType.VIDEO) ? metadataReader.readDurationSeconds(file).orElse(null) : null;
        long size = Files.size(file);

        String name = session.placement.place(directory, sourceName, fingerprint);
        Path target = store.resolve(directory, name);

        boolean placed = false;
        if (!Files.exists(target)) {
            if (props.getMode() == ArchiveProperties.TransferMode.MOVE) {
                store.moveInto(file, target);
            } else {
                store.copyInto(file, target);
            }
            placed = true;
        } else {
            log.info("archive already holds this content at {}, not copying {}", target, file);
        }

        MediaDraft draft = new MediaDraft(directory, name, type, fingerprint, size, duration, exifDate, fileDate, session.startedAt);
        try {
            MediaIndexService.RecordResult r = index.recordNewMedia(draft, SourceLocation.of(file), tags);
            log.info("imported {} -> {}/{}", file, directory, name);
            return r;
        } catch (IndexWriteException e) {
            if (placed) undoPlacement(file, target, e);
            session.placement.release(directory, name);
            throw e;
        }
    }

    private void undoPlacement(Path source, Path target, IndexWriteException cause) {
        try {
            if (props.getMode() == ArchiveProperties.TransferMode.MOVE) {
                store.moveBack(target, source);
            } else {
                store.delete(target);
            }
        } catch (IOException undoFailure) {
            log.error("cannot undo placement of {} at {}", source, target, undoFailure);
            cause.addSuppressed(undoFailure);
        }
    }

    private List<String> tagsFor(Path root, Path file, Map<Path, Integer> filesPerFolder, Session session) {
        Path folder = file.getParent();
        Path relative = root.relativize(folder);
        String folderKey = FolderKeys.key(session.rootLabels.get(root), relative);

        List<String> confirmed = session.confirmedTags.get(folderKey);
        if (confirmed == null) {
            int count = filesPerFolder.getOrDefault(folder, 0);
            List<String> suggested = session.extractor.extract(relative);
            confirmed = List.copyOf(tagPrompt.confirm(folderKey, suggested, count));
            session.confirmedTags.put(folderKey, confirmed);
            session.reviewRows.put(folderKey, new TagReviewCsv.Row(folderKey, count, confirmed));
        }

        Set<String> tags = new LinkedHashSet<>(confirmed);
        if (FolderTagExtractor.looksLikeThumbnail(folder.toString(), file.getFileName().toString())) {
            tags.add(FolderTagExtractor.THUMBNAIL_TAG);
        }
        return new ArrayList<>(tags);
    }

    private PlacementSession.OwnerLookup ownerLookup() {
        return new PlacementSession.OwnerLookup() {
            @Override
            public Optional<String> fingerprintAt(String relativeDirectory, String filename) {
                return index.fingerprintAt(relativeDirectory, filename);
            }

            @Override
            public String hashOccupant(Path file) throws IOException {
                return hasher.hash(file);
            }
        };
    }

    private static final class Session {
        final LocalDateTime startedAt;
        final SessionStats stats;
        final PlacementSession placement;
        final FolderTagExtractor extractor;
        final Map<Path, String> rootLabels;
        final Map<String, List<String>> confirmedTags = new HashMap<>();
        final Map<String, TagReviewCsv.Row> reviewRows = new LinkedHashMap<>();

        Session(LocalDateTime startedAt, SessionStats stats, PlacementSession placement,
                FolderTagExtractor extractor, Map<Path, String> rootLabels) {
            this.startedAt = startedAt;
            this.stats = stats;
            this.placement = placement;
            this.extractor = extractor;
            this.rootLabels = rootLabels;
        }
    }
}
