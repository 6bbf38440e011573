package com.fileservice.exception;

import org.springframework.http.HttpStatus;

public class FileRecordNotFoundException extends FileServiceException {

    public static final String CODE = "not_found";

    public FileRecordNotFoundException(String message) {
        super(CODE, HttpStatus.NOT_FOUND, message);
    }

    public static FileRecordNotFoundException file(Object id) {
        return new FileRecordNotFoundException("File not found: " + id);
    }

    public static FileRecordNotFoundException thumbnail(Object id) {
        return new FileRecordNotFoundException("Thumbnail not available: " + id);
    }
}
