package com.classmonitor.exception;

import com.classmonitor.dto.ErrorResponse.ErrorCode;

/**
 * Rejected ingest request (bad key, bad image, evidence that could not be stored).
 */
public class IngestException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String details;

    public IngestException(ErrorCode errorCode, String details) {
        super(errorCode.getMessage() + ": " + details);
        this.errorCode = errorCode;
        this.details = details;
    }

    public IngestException(ErrorCode errorCode, String details, Throwable cause) {
        super(errorCode.getMessage() + ": " + details, cause);
        this.errorCode = errorCode;
        this.details = details;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getDetails() {
        return details;
    }

    public String getCode() {
        return errorCode.getCode();
    }
}
