package com.fileservice.thumbnail;

/**
 * 缩略图生成结果。失败不是异常：上传照常成功，只是 thumbnail_path 为空。
 */
public record ThumbnailResult(Status status, String key, String reason) {

    public enum Status { CREATED, FAILED, SKIPPED }

    public static ThumbnailResult created(String key) {
        return new ThumbnailResult(Status.CREATED, key, null);
    }

    public static ThumbnailResult failed(String reason) {
        return new ThumbnailResult(Status.FAILED, null, reason);
    }

    public static ThumbnailResult skipped() {
        return new ThumbnailResult(Status.SKIPPED, null, null);
    }

    public boolean isCreated() {
        return status == Status.CREATED;
    }
}
