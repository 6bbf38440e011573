package com.fileservice.file.service.impl;

import com.fileservice.exception.DedupConflictException;
import com.fileservice.file.domain.FileRecord;
import com.fileservice.file.service.FileRecordService;
import com.fileservice.mapper.FileRecordMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class FileRecordServiceImpl implements FileRecordService {

    private final FileRecordMapper fileRecordMapper;

    @Override
    public FileRecord insert(FileRecord record) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        if (record.getUploadedAt() == null) {
            record.setUploadedAt(now);
        }
        record.setUpdatedAt(now);
        try {
            fileRecordMapper.insert(record);
        } catch (DuplicateKeyException e) {
            // 主键是新生成的 UUID，唯一能撞的只有 checksum 唯一索引
            throw new DedupConflictException(record.getChecksum(), e);
        }
        return record;
    }

    @Override
    public Optional<FileRecord> findById(UUID id) {
        return Optional.ofNullable(fileRecordMapper.selectById(id));
    }

    @Override
    public Optional<FileRecord> findByChecksum(String checksum) {
        return Optional.ofNullable(fileRecordMapper.selectByChecksum(checksum));
    }

    @Override
    public List<FileRecord> listRecent(int limit) {
        return fileRecordMapper.selectRecent(Math.max(limit, 1));
    }

    @Override
    public boolean delete(UUID id) {
        return fileRecordMapper.deleteById(id) > 0;
    }

    @Override
    public Set<String> referencedKeys() {
        return new HashSet<>(fileRecordMapper.selectReferencedKeys());
    }
}
