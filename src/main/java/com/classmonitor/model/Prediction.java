package com.classmonitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One detection box drawn over a frame. Coordinates are in source image pixels,
 * with (x, y) the top-left corner.
 */
public record Prediction(
        double x,
        double y,
        double w,
        double h,
        @JsonProperty("class") String label,
        @JsonProperty("conf") double confidence) {
}
