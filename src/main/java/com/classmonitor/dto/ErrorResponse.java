package com.classmonitor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;

/**
 * JSON body for rejected ingest and admin requests.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String type, String code, String message, String details, LocalDateTime timestamp) {

    public static ErrorResponse of(ErrorCode errorCode) {
        return of(errorCode, null);
    }

    public static ErrorResponse of(ErrorCode errorCode, String details) {
        return new ErrorResponse("error", errorCode.getCode(), errorCode.getMessage(), details, LocalDateTime.now());
    }

    /**
     * Error codes with the HTTP status each one is reported under.
     */
    public enum ErrorCode {
        // Validation errors (VAL_XXX)
        VAL_001("Invalid input", HttpStatus.BAD_REQUEST),
        VAL_002("Missing required field", HttpStatus.BAD_REQUEST),
        VAL_003("Field exceeds maximum length", HttpStatus.BAD_REQUEST),
        VAL_004("Invalid identifier format", HttpStatus.BAD_REQUEST),
        VAL_005("Invalid image encoding", HttpStatus.BAD_REQUEST),

        // Evidence errors (EVID_XXX)
        EVID_001("Failed to save evidence image", HttpStatus.INTERNAL_SERVER_ERROR),

        // Server errors (SRV_XXX)
        SRV_001("Internal server error", HttpStatus.INTERNAL_SERVER_ERROR);

        private final String message;
        private final HttpStatus status;

        ErrorCode(String message, HttpStatus status) {
            this.message = message;
            this.status = status;
        }

        public String getCode() {
            return name();
        }

        public String getMessage() {
            return message;
        }

        public HttpStatus getStatus() {
            return status;
        }
    }
}
