package com.classmonitor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for camera relays and frame pullers
 * Binds to classmonitor.relay.* properties in application.yml
 */
@Configuration
@ConfigurationProperties(prefix = "classmonitor.relay")
public class RelayProperties {

    private int channelCapacity = 4;
    private long keepaliveInterval = 10000; // 10 seconds
    private long idleInterval = 2000; // no viewers
    private long frameInterval = 500; // caps fetch rate at 2 fps
    private long failureBackoff = 1000; // unknown device, non-2xx or empty body
    private long errorBackoff = 2000; // anything else
    private long requestTimeout = 5000;
    private String snapshotPath = "/capture";
    private int maxSnapshotBytes = 5 * 1024 * 1024; // 5MB
    private long livenessCheckInterval = 10000;

    public int getChannelCapacity() {
        return channelCapacity;
    }

    public void setChannelCapacity(int channelCapacity) {
        this.channelCapacity = channelCapacity;
    }

    public long getKeepaliveInterval() {
        return keepaliveInterval;
    }

    public void setKeepaliveInterval(long keepaliveInterval) {
        this.keepaliveInterval = keepaliveInterval;
    }

    public long getIdleInterval() {
        return idleInterval;
    }

    public void setIdleInterval(long idleInterval) {
        this.idleInterval = idleInterval;
    }

    public long getFrameInterval() {
        return frameInterval;
    }

    public void setFrameInterval(long frameInterval) {
        this.frameInterval = frameInterval;
    }

    public long getFailureBackoff() {
        return failureBackoff;
    }

    public void setFailureBackoff(long failureBackoff) {
        this.failureBackoff = failureBackoff;
    }

    public long getErrorBackoff() {
        return errorBackoff;
    }

    public void setErrorBackoff(long errorBackoff) {
        this.errorBackoff = errorBackoff;
    }

    public long getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(long requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public String getSnapshotPath() {
        return snapshotPath;
    }

    public void setSnapshotPath(String snapshotPath) {
        this.snapshotPath = snapshotPath;
    }

    public int getMaxSnapshotBytes() {
        return maxSnapshotBytes;
    }

    public void setMaxSnapshotBytes(int maxSnapshotBytes) {
        this.maxSnapshotBytes = maxSnapshotBytes;
    }

    public long getLivenessCheckInterval() {
        return livenessCheckInterval;
    }

    public void setLivenessCheckInterval(long livenessCheckInterval) {
        this.livenessCheckInterval = livenessCheckInterval;
    }
}
