package com.classmonitor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for alert delivery
 * Binds to classmonitor.alerts.* properties in application.yml
 */
@Configuration
@ConfigurationProperties(prefix = "classmonitor.alerts")
public class AlertProperties {

    // Receives a copy of every alert; blank disables mirroring
    private String mirrorIdentifier = "1";
    private int connectionBufferSize = 64;
    private String evidenceDirectory = "uploads/evidence";
    private String evidenceBaseUrl = "http://localhost:8080";
    private String evidenceUrlPath = "/uploads/evidence"; // served from evidenceDirectory

    public String getMirrorIdentifier() {
        return mirrorIdentifier;
    }

    public void setMirrorIdentifier(String mirrorIdentifier) {
        this.mirrorIdentifier = mirrorIdentifier;
    }

    public int getConnectionBufferSize() {
        return connectionBufferSize;
    }

    public void setConnectionBufferSize(int connectionBufferSize) {
        this.connectionBufferSize = connectionBufferSize;
    }

    public String getEvidenceDirectory() {
        return evidenceDirectory;
    }

    public void setEvidenceDirectory(String evidenceDirectory) {
        this.evidenceDirectory = evidenceDirectory;
    }

    public String getEvidenceBaseUrl() {
        return evidenceBaseUrl;
    }

    public void setEvidenceBaseUrl(String evidenceBaseUrl) {
        this.evidenceBaseUrl = evidenceBaseUrl;
    }

    public String getEvidenceUrlPath() {
        return evidenceUrlPath;
    }

    public void setEvidenceUrlPath(String evidenceUrlPath) {
        this.evidenceUrlPath = evidenceUrlPath;
    }
}
