package com.classmonitor.validation;

import com.classmonitor.dto.ErrorResponse.ErrorCode;
import com.classmonitor.exception.IngestException;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Centralized input validation for ingest and WebSocket path parameters.
 */
@Component
public class InputValidator {

    // Source keys and identifiers: alphanumeric, hyphens, underscores, max 64 chars
    private static final Pattern KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    private static final int MAX_DETAIL_LENGTH = 1000;
    private static final int MAX_IMAGE_LENGTH = 10 * 1024 * 1024; // 10 MB of base64

    public void validateSourceKey(String sourceKey) {
        validateKey(sourceKey, "Source key");
    }

    public void validateIdentifier(String identifier) {
        validateKey(identifier, "Identifier");
    }

    public boolean isValidKey(String key) {
        return key != null && KEY_PATTERN.matcher(key).matches();
    }

    public void validateDetail(String detail) {
        if (detail == null || detail.isBlank()) {
            throw new IngestException(ErrorCode.VAL_002, "Detail is required");
        }
        if (detail.length() > MAX_DETAIL_LENGTH) {
            throw new IngestException(ErrorCode.VAL_003, "Detail exceeds maximum length of " + MAX_DETAIL_LENGTH);
        }
    }

    /**
     * Decode a base64 image, accepting an optional data URI header.
     */
    public byte[] decodeImage(String image) {
        if (image == null || image.isBlank()) {
            throw new IngestException(ErrorCode.VAL_002, "Image is required");
        }
        if (image.length() > MAX_IMAGE_LENGTH) {
            throw new IngestException(ErrorCode.VAL_003, "Image exceeds maximum size");
        }
        String encoded = image.startsWith("data:") && image.contains(",")
                ? image.substring(image.indexOf(',') + 1)
                : image;
        try {
            byte[] bytes = Base64.getMimeDecoder().decode(encoded);
            if (bytes.length == 0) {
                throw new IngestException(ErrorCode.VAL_005, "Image is empty");
            }
            return bytes;
        } catch (IllegalArgumentException e) {
            throw new IngestException(ErrorCode.VAL_005, "Image is not valid base64", e);
        }
    }

    private void validateKey(String key, String name) {
        if (key == null || key.isEmpty()) {
            throw new IngestException(ErrorCode.VAL_002, name + " is required");
        }
        if (!KEY_PATTERN.matcher(key).matches()) {
            throw new IngestException(ErrorCode.VAL_004,
                    name + " can only contain letters, numbers, hyphens, and underscores (max 64)");
        }
    }
}
