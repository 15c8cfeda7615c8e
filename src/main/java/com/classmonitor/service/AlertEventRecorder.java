package com.classmonitor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.classmonitor.model.AlertEvent;
import com.classmonitor.repository.AlertEventRepository;

/**
 * Fire-and-forget persistence of raised alerts. Callers never wait on the store
 * and a failed write only gets logged.
 */
@Service
public class AlertEventRecorder {

    private static final Logger log = LoggerFactory.getLogger(AlertEventRecorder.class);

    private final AlertEventRepository alertEventRepository;

    public AlertEventRecorder(AlertEventRepository alertEventRepository) {
        this.alertEventRepository = alertEventRepository;
    }

    public void record(AlertEvent event) {
        alertEventRepository.save(event).subscribe(
                saved -> log.debug("Recorded alert event {} for source {}", saved.getId(), saved.getSourceKey()),
                error -> log.error("Failed to record alert event for source {}: {}",
                        event.getSourceKey(), error.getMessage()));
    }
}
