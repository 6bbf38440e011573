package com.fileservice.exception;

import org.springframework.http.HttpStatus;

/** 存储后端 I/O、网络、超时失败。与 {@link BlobNotFoundException} 严格区分。 */
public class BackendUnavailableException extends FileServiceException {

    public static final String CODE = "backend_unavailable";

    public BackendUnavailableException(String message, Throwable cause) {
        super(CODE, HttpStatus.BAD_GATEWAY, message, cause);
    }

    public BackendUnavailableException(String message) {
        this(message, null);
    }
}
