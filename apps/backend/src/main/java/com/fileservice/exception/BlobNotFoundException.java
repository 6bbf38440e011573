package com.fileservice.exception;

import org.springframework.http.HttpStatus;

/**
 * 存储层信号：key 在后端不存在。
 * 检索服务会把它转换成 {@link StorageInconsistencyException}，不会直接返回给客户端。
 */
public class BlobNotFoundException extends FileServiceException {

    public static final String CODE = "blob_not_found";

    public BlobNotFoundException(String key) {
        this(key, null);
    }

    public BlobNotFoundException(String key, Throwable cause) {
        super(CODE, HttpStatus.NOT_FOUND, "Blob not found: " + key, cause);
    }
}
