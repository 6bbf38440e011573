package com.fileservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fileservice.file.domain.FileRecord;

import java.util.UUID;

/**
 * 上传成功后返回给客户端的信息。去重命中时返回的是已有记录。
 */
public record UploadFileResponse(
        UUID id,
        String filename,
        String url,          // 元数据地址 /files/{id}
        long size,           // 文件大小（字节）
        @JsonProperty("mime_type") String mimeType
) {

    public static UploadFileResponse from(FileRecord record) {
        return new UploadFileResponse(
                record.getId(),
                record.getFilename(),
                FileResponse.metadataUrl(record.getId()),
                record.getFileSize(),
                record.getMimeType()
        );
    }
}
