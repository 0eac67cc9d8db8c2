package com.nowa.archive.ingest;

import java.nio.file.Path;
import java.time.LocalDateTime;

/** 單次匯入的結果與輸出位置；沒看到任何檔案時 tagReviewCsv 為 null */
public record IngestionReport(
        LocalDateTime startedAt,
        SessionStats stats,
        int exportedRecords,
        Path exportFile,
        Path tagReviewCsv
) {}
