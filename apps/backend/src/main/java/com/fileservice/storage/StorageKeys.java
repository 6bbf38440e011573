package com.fileservice.storage;

/**
 * 存储 key 的布局：原文件在 files/ 下，缩略图在 thumbnails/ 下。
 * 写入、缩略图推导和孤儿清理都从这里取前缀。
 */
public final class StorageKeys {

    public static final String FILES_PREFIX = "files/";
    public static final String THUMBNAILS_PREFIX = "thumbnails/";

    private StorageKeys() {}

    /** {filename} -> files/{filename} */
    public static String fileKey(String filename) {
        return FILES_PREFIX + filename;
    }

    /** files/{name} -> thumbnails/{name}.png */
    public static String thumbnailKey(String originalKey) {
        String name = originalKey.startsWith(FILES_PREFIX)
                ? originalKey.substring(FILES_PREFIX.length())
                : originalKey;
        return THUMBNAILS_PREFIX + name + ".png";
    }
}
