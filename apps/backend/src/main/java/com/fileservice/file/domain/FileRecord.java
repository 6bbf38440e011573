package com.fileservice.file.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * files 表的一行。除 updatedAt 外全部字段写入后不可变。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileRecord {

    private UUID id;

    /** {id}_{清洗后的文件名}，按构造唯一 */
    private String filename;

    private String originalFilename;

    /** 后端存储 key，例如 files/{filename} */
    private String filePath;

    private Long fileSize;

    private String mimeType;

    /** local / s3 */
    private String storageType;

    /** SHA-256 hex，去重键 */
    private String checksum;

    /** 缩略图 key；非图片或生成失败时为 null */
    private String thumbnailPath;

    private OffsetDateTime uploadedAt;

    private OffsetDateTime updatedAt;
}
