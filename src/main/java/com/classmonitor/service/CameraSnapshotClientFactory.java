package com.classmonitor.service;

import java.time.Duration;

import org.springframework.stereotype.Component;

import com.classmonitor.config.RelayProperties;

/**
 * Creates the per-source snapshot clients used by frame pullers.
 */
@Component
public class CameraSnapshotClientFactory {

    private final RelayProperties relayProperties;

    public CameraSnapshotClientFactory(RelayProperties relayProperties) {
        this.relayProperties = relayProperties;
    }

    public CameraSnapshotClient create(String sourceKey) {
        return new CameraSnapshotClient(
                sourceKey,
                Duration.ofMillis(relayProperties.getRequestTimeout()),
                relayProperties.getSnapshotPath(),
                relayProperties.getMaxSnapshotBytes());
    }
}
