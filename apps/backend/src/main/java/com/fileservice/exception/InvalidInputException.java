package com.fileservice.exception;

import org.springframework.http.HttpStatus;

/** 缺少 multipart 字段、扩展名不允许、非法 key 等；无副作用，直接 400。 */
public class InvalidInputException extends FileServiceException {

    public static final String CODE = "invalid_input";

    public InvalidInputException(String message) {
        super(CODE, HttpStatus.BAD_REQUEST, message);
    }
}
