package com.classmonitor.dto;

import java.util.List;

import com.classmonitor.model.Frame;
import com.classmonitor.model.Prediction;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Message sent to stream viewers: a frame or a keepalive.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamMessage(String type, String sourceKey, String image, List<Prediction> predictions) {

    public static StreamMessage frame(Frame frame) {
        return new StreamMessage("frame", frame.sourceKey(), frame.image(), frame.predictions());
    }

    public static StreamMessage keepalive(String sourceKey) {
        return new StreamMessage("keepalive", sourceKey, null, null);
    }
}
