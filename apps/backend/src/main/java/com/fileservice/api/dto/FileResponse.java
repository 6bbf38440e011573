package com.fileservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fileservice.file.domain.FileRecord;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * 对外的元数据投影。URL 都是计算出来的，不落库。
 */
public record FileResponse(
        UUID id,
        String filename,
        @JsonProperty("original_filename") String originalFilename,
        long size,
        @JsonProperty("mime_type") String mimeType,
        @JsonProperty("uploaded_at") OffsetDateTime uploadedAt,
        @JsonProperty("download_url") String downloadUrl,
        @JsonProperty("thumbnail_url") String thumbnailUrl   // 没有缩略图时为 null
) {

    public static FileResponse from(FileRecord record) {
        UUID id = record.getId();
        return new FileResponse(
                id,
                record.getFilename(),
                record.getOriginalFilename(),
                record.getFileSize(),
                record.getMimeType(),
                record.getUploadedAt(),
                metadataUrl(id) + "/download",
                record.getThumbnailPath() != null ? metadataUrl(id) + "/thumbnail" : null
        );
    }

    static String metadataUrl(UUID id) {
        return "/files/" + id;
    }
}
