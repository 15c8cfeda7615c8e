package com.classmonitor.dto;

import java.util.List;

import com.classmonitor.model.Prediction;

import jakarta.validation.constraints.NotBlank;

/**
 * Annotated frame pushed by the detection pipeline.
 * {@code image} is a data URI or bare base64 JPEG.
 */
public record FrameIngestRequest(@NotBlank String image, List<Prediction> predictions) {
}
