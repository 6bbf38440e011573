package com.fileservice.exception;

import org.springframework.http.HttpStatus;

/**
 * 读取客户端上传流失败（断开连接、multipart 损坏）。
 * 与存储后端故障区分开，避免把客户端问题报成 502。
 */
public class UploadInterruptedException extends FileServiceException {

    public static final String CODE = "upload_interrupted";

    public UploadInterruptedException(String message, Throwable cause) {
        super(CODE, HttpStatus.BAD_REQUEST, message, cause);
    }
}
