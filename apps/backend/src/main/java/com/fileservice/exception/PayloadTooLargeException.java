package com.fileservice.exception;

import org.springframework.http.HttpStatus;

public class PayloadTooLargeException extends FileServiceException {

    public static final String CODE = "file_too_large";

    private final long maxBytes;

    public PayloadTooLargeException(long maxBytes, long actualBytes) {
        super(CODE, HttpStatus.PAYLOAD_TOO_LARGE,
                "File too large: " + actualBytes + " bytes exceeds maximum of " + maxBytes + " bytes");
        this.maxBytes = maxBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }
}
