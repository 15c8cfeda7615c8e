package com.classmonitor.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Violation raised by the detection pipeline, with a base64 evidence image
 * (plain or as a data URI).
 */
public record ViolationReport(
        @NotNull Long classId,
        @NotNull Long teacherId,
        @NotBlank String detail,
        @NotBlank String evidence) {
}
