package com.nowa.archive.metadata;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 放置日期順序：EXIF > FILE_MODIFIED
 * 兩者不一致時這裡不做判斷；兩個日期都會存進紀錄。
 */
public final class CaptureDateResolver {

    public enum DateSource { EXIF, FILE_MODIFIED }

    public record Result(LocalDateTime placementDate, DateSource source) {

        /** YYYY/MM */
        public String archiveDirectory() {
            return String.format("%04d/%02d", placementDate.getYear(), placementDate.getMonthValue());
        }
    }

    public Result resolve(LocalDateTime exifDate, LocalDateTime fileDate) {
        Objects.requireNonNull(fileDate, "fileDate");
        if (exifDate != null) return new Result(exifDate, DateSource.EXIF);
        return new Result(fileDate, DateSource.FILE_MODIFIED);
    }
}
