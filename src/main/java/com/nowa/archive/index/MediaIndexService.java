package com.nowa.archive.index;

import com.nowa.archive.index.entity.MediaEntity;
import com.nowa.archive.index.entity.MediaSourceEntity;
import com.nowa.archive.index.entity.MediaTagEntity;
import com.nowa.archive.index.entity.SourceItemEntity;
import com.nowa.archive.index.entity.TagEntity;
import com.nowa.archive.index.repo.MediaRepository;
import com.nowa.archive.index.repo.MediaSourceRepository;
import com.nowa.archive.index.repo.MediaTagRepository;
import com.nowa.archive.index.repo.SourceItemRepository;
import com.nowa.archive.index.repo.TagRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Index：fingerprint -> archive 正式位置，以及所有已知來源與 tag。
 * ✅ 來源與 tag 只會增加（set union）；唯一例外是 replaceTags
 */
@Slf4j
@Service
public class MediaIndexService {

    private final MediaRepository mediaRepo;
    private final TagRepository tagRepo;
    private final MediaTagRepository mediaTagRepo;
    private final SourceItemRepository sourceItemRepo;
    private final MediaSourceRepository mediaSourceRepo;
    private final TransactionTemplate tx;

    public MediaIndexService(MediaRepository mediaRepo,
                             TagRepository tagRepo,
                             MediaTagRepository mediaTagRepo,
                             SourceItemRepository sourceItemRepo,
                             MediaSourceRepository mediaSourceRepo,
                             PlatformTransactionManager txManager) {
        this.mediaRepo = mediaRepo;
        this.tagRepo = tagRepo;
        this.mediaTagRepo = mediaTagRepo;
        this.sourceItemRepo = sourceItemRepo;
        this.mediaSourceRepo = mediaSourceRepo;
        this.tx = new TransactionTemplate(txManager);
    }

    /** 單一檔案 transaction 的結果 */
    public record RecordResult(Long mediaId, boolean sourceAdded, int tagsAdded) {}

    // ===== reads =====

    @Transactional(readOnly = true)
    public Optional<MediaEntity> findByFingerprint(String fingerprint) {
        return mediaRepo.findByHashSignature(fingerprint);
    }

    @Transactional(readOnly = true)
    public Optional<String> fingerprintAt(String archivePath, String archiveFilename) {
        return mediaRepo.findByArchivePathAndArchiveFilename(archivePath, archiveFilename)
                .map(MediaEntity::getHashSignature);
    }

    @Transactional(readOnly = true)
    public Set<String> allFingerprints() {
        return new HashSet<>(mediaRepo.findAllHashSignatures());
    }

    @Transactional(readOnly = true)
    public List<IndexedLocation> allMediaWithLocations() {
        List<IndexedLocation> out = new ArrayList<>();
        for (Object[] row : mediaRepo.findAllLocations()) {
            out.add(new IndexedLocation((String) row[0], row[1] + "/" + row[2]));
        }
        return out;
    }

    @Transactional(readOnly = true)
    public List<MediaDetails> allMediaWithDetails() {
        List<MediaDetails> out = new ArrayList<>();
        for (MediaEntity m : mediaRepo.findAllByOrderByIdAsc()) {
            out.add(new MediaDetails(m, tagsFor(m.getId()), sourcesFor(m.getId())));
        }
        return out;
    }

    @Transactional(readOnly = true)
    public List<String> tagsFor(Long mediaId) {
        return tagRepo.findValuesByMediaId(mediaId);
    }

    /** 完整路徑：directory + "/" + filename */
    @Transactional(readOnly = true)
    public List<String> sourcesFor(Long mediaId) {
        List<String> out = new ArrayList<>();
        for (Object[] row : mediaSourceRepo.findSourcesByMediaId(mediaId)) {
            out.add(row[0] + "/" + row[1]);
        }
        return out;
    }

    @Transactional(readOnly = true)
    public List<Long> mediaIdsBySourcePath(String sourcePath) {
        return mediaRepo.findIdsBySourcePath(sourcePath);
    }

    // ===== writes =====

    @Transactional
    public Long insertMedia(MediaDraft draft) {
        return mediaRepo.saveAndFlush(draft.toEntity()).getId();
    }

    /** idempotent：已知的 (directory, filename) 不做事 */
    @Transactional
    public boolean addSource(Long mediaId, String directory, String filename) {
        SourceItemEntity item = sourceItemRepo.findBySourcePath(directory)
                .orElseGet(() -> sourceItemRepo.saveAndFlush(new SourceItemEntity(directory)));

        if (mediaSourceRepo.existsByMediaIdAndSourceItemIdAndSourceFilename(mediaId, item.getId(), filename)) {
            return false;
        }
        mediaSourceRepo.saveAndFlush(new MediaSourceEntity(mediaId, item.getId(), filename));
        return true;
    }

    /** union，不取代；回傳新增幾個關聯 */
    @Transactional
    public int attachTags(Long mediaId, Collection<String> values) {
        int added = 0;
        for (String value : distinctNonBlank(values)) {
            TagEntity tag = getOrCreateTag(value);
            if (mediaTagRepo.existsByMediaIdAndTagId(mediaId, tag.getId())) continue;
            mediaTagRepo.saveAndFlush(new MediaTagEntity(mediaId, tag.getId()));
            added++;
        }
        return added;
    }

    /** 明確的 replace（tag review 用）。tag 本身保留，只改關聯 */
    @Transactional
    public void replaceTags(Long mediaId, Collection<String> values) {
        mediaTagRepo.deleteByMediaId(mediaId);
        mediaTagRepo.flush();
        for (String value : distinctNonBlank(values)) {
            TagEntity tag = getOrCreateTag(value);
            mediaTagRepo.saveAndFlush(new MediaTagEntity(mediaId, tag.getId()));
        }
        log.debug("tags replaced. mediaId={}, tags={}", mediaId, values);
    }

    // ===== per-file transactions =====

    /**
     * 新 media：紀錄 + 第一個來源 + 初始 tag，✅ 全部一起成功或全部不存在
     *
     * @throws IndexWriteException rollback 之後丟出
     */
    public RecordResult recordNewMedia(MediaDraft draft, SourceLocation source, Collection<String> tags) {
        return inTransaction(draft.hashSignature(), () -> {
            Long id = insertMedia(draft);
            boolean added = addSource(id, source.directory(), source.filename());
            int tagsAdded = attachTags(id, tags);
            return new RecordResult(id, added, tagsAdded);
        });
    }

    /**
     * 已知 media：追加來源 + tag。✅ archive 位置永遠不動
     *
     * @throws IndexWriteException rollback 之後丟出
     */
    public RecordResult recordDuplicate(MediaEntity existing, SourceLocation source, Collection<String> tags) {
        return inTransaction(existing.getHashSignature(), () -> {
            boolean added = addSource(existing.getId(), source.directory(), source.filename());
            int tagsAdded = attachTags(existing.getId(), tags);
            return new RecordResult(existing.getId(), added, tagsAdded);
        });
    }

    private RecordResult inTransaction(String fingerprint, Supplier<RecordResult> work) {
        try {
            return tx.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.debug("index transaction rolled back. fingerprint={}", fingerprint);
            throw new IndexWriteException(fingerprint, "INDEX_WRITE_FAILED: " + e.getMessage(), e);
        }
    }

    private TagEntity getOrCreateTag(String value) {
        return tagRepo.findByValue(value)
                .orElseGet(() -> tagRepo.saveAndFlush(new TagEntity(value)));
    }

    private static Set<String> distinctNonBlank(Collection<String> values) {
        Set<String> out = new LinkedHashSet<>();
        if (values == null) return out;
        for (String v : values) {
            if (v == null || v.isBlank()) continue;
            String tag = v.trim();
            if (tag.length() > TagEntity.MAX_LENGTH) {
                log.warn("tag longer than {} chars truncated: {}", TagEntity.MAX_LENGTH, tag);
                tag = tag.substring(0, TagEntity.MAX_LENGTH);
            }
            out.add(tag);
        }
        return out;
    }
}
