package com.fileservice.file.service;

import com.fileservice.exception.DedupConflictException;
import com.fileservice.file.domain.FileRecord;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * 元数据存储：文件“是否存在”的唯一事实来源。所有方法都是阻塞调用。
 */
public interface FileRecordService {

    /**
     * 插入一条记录。
     *
     * @throws DedupConflictException checksum 已被另一条记录占用（并发上传相同内容）
     */
    FileRecord insert(FileRecord record);

    Optional<FileRecord> findById(UUID id);

    Optional<FileRecord> findByChecksum(String checksum);

    /** 按 uploaded_at 倒序取最近 limit 条 */
    List<FileRecord> listRecent(int limit);

    /** 删除记录，返回是否真的删掉了一行 */
    boolean delete(UUID id);

    Set<String> referencedKeys();
}
