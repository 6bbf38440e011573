package com.fileservice.exception;

import org.springframework.http.HttpStatus;

/** 元数据记录存在但后端缺少对应 blob，需要人工对账。 */
public class StorageInconsistencyException extends FileServiceException {

    public static final String CODE = "storage_inconsistency";

    public StorageInconsistencyException(String message, Throwable cause) {
        super(CODE, HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
