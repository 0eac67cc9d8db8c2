package com.nowa.archive.index;

import com.nowa.archive.index.entity.MediaEntity;

import java.util.List;

/** 單筆紀錄的展開檢視：media row + tags + 完整來源路徑 */
public record MediaDetails(MediaEntity media, List<String> tags, List<String> sources) {}
