package com.classmonitor.model;

import java.time.Instant;
import java.util.Base64;
import java.util.List;

/**
 * A single relayed camera image with its detections.
 * Immutable, so one instance is shared by every subscriber channel.
 */
public record Frame(String sourceKey, String image, List<Prediction> predictions, Instant capturedAt) {

    public static final String JPEG_DATA_URI_PREFIX = "data:image/jpeg;base64,";

    public Frame {
        if (sourceKey == null || sourceKey.isBlank()) {
            throw new IllegalArgumentException("Frame source key is required");
        }
        if (image == null || image.isEmpty()) {
            throw new IllegalArgumentException("Frame image is required");
        }
        predictions = predictions == null ? List.of() : List.copyOf(predictions);
        capturedAt = capturedAt == null ? Instant.now() : capturedAt;
    }

    /**
     * Build a frame from raw JPEG bytes, encoding them as a data URI.
     */
    public static Frame fromJpeg(String sourceKey, byte[] jpeg, List<Prediction> predictions) {
        String image = JPEG_DATA_URI_PREFIX + Base64.getEncoder().encodeToString(jpeg);
        return new Frame(sourceKey, image, predictions, Instant.now());
    }
}
