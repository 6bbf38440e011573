package com.fileservice.exception;

import org.springframework.http.HttpStatus;

/**
 * 文件服务统一异常基类：携带错误码与 HTTP 状态，GlobalExceptionHandler 直接据此输出，不需要按类型分支。
 */
public class FileServiceException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    public FileServiceException(String code, HttpStatus status, String message) {
        this(code, status, message, null);
    }

    public FileServiceException(String code, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
