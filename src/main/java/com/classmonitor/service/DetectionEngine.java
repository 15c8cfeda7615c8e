package com.classmonitor.service;

import java.util.List;

import com.classmonitor.model.Prediction;

import reactor.core.publisher.Mono;

/**
 * Object detector applied to each pulled camera image.
 */
public interface DetectionEngine {

    Mono<List<Prediction>> detect(byte[] jpeg);
}
