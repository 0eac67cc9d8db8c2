package com.nowa.archive.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** 每筆 MediaRecord 一行 JSONL；日期為 ISO-8601 local date-time */
@JsonPropertyOrder({"archive_path", "hash", "tags", "sources", "exif_date", "file_date", "ingested_at", "duration"})
public record MetadataLine(
        @JsonProperty("archive_path") String archivePath,
        @JsonProperty("hash") String hash,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("sources") List<String> sources,
        @JsonProperty("exif_date") String exifDate,
        @JsonProperty("file_date") String fileDate,
        @JsonProperty("ingested_at") String ingestedAt,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @JsonProperty("duration") Double duration
) {}
