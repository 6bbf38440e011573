package com.fileservice.storage;

/** 记录在 files.storage_type 上的后端标签，一经写入不可变。 */
public enum StorageType {
    LOCAL("local"),
    S3("s3");

    private final String tag;

    StorageType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
