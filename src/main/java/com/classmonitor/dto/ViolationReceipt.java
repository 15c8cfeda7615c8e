package com.classmonitor.dto;

/**
 * Response to a recorded violation.
 */
public record ViolationReceipt(String status, String imageUrl, int devicesNotified) {
}
