package com.fileservice.ingest;

import com.fileservice.file.domain.FileRecord;

/**
 * @param deduplicated true 表示内容已存在，返回的是已有的规范记录
 */
public record IngestionResult(FileRecord record, boolean deduplicated) {

    public static IngestionResult created(FileRecord record) {
        return new IngestionResult(record, false);
    }

    public static IngestionResult deduplicated(FileRecord record) {
        return new IngestionResult(record, true);
    }
}
