package com.fileservice.exception;

import org.springframework.http.HttpStatus;

/**
 * 并发上传相同内容时，后提交的一方撞上 checksum 唯一索引。
 * 只在管道内部使用，由 IngestionPipeline 回退到已有记录，永远不会返回给客户端。
 */
public class DedupConflictException extends FileServiceException {

    public static final String CODE = "dedup_conflict";

    private final String checksum;

    public DedupConflictException(String checksum, Throwable cause) {
        super(CODE, HttpStatus.CONFLICT, "Duplicate checksum: " + checksum, cause);
        this.checksum = checksum;
    }

    public String getChecksum() {
        return checksum;
    }
}
