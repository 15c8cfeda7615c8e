package com.classmonitor.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.classmonitor.config.AlertProperties;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Writes violation evidence images to disk and builds their public URL.
 */
@Service
public class EvidenceStorageService {

    private static final Logger logger = LoggerFactory.getLogger(EvidenceStorageService.class);

    private final Path evidenceDirectory;
    private final String evidenceBaseUrl;
    private final String evidenceUrlPath;

    public EvidenceStorageService(AlertProperties alertProperties) {
        this.evidenceDirectory = Paths.get(alertProperties.getEvidenceDirectory());
        this.evidenceBaseUrl = trimTrailingSlash(alertProperties.getEvidenceBaseUrl());
        String urlPath = trimTrailingSlash(alertProperties.getEvidenceUrlPath());
        this.evidenceUrlPath = urlPath.startsWith("/") ? urlPath : "/" + urlPath;
    }

    /**
     * Store one JPEG under a random name.
     *
     * @return the stored evidence
     */
    public Mono<StoredEvidence> store(byte[] jpeg) {
        return Mono.fromCallable(() -> {
                    Files.createDirectories(evidenceDirectory);
                    String fileName = "violation_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8) + ".jpg";
                    Path file = evidenceDirectory.resolve(fileName);
                    Files.write(file, jpeg);
                    logger.info("📸 Saved evidence {} ({} bytes)", file, jpeg.length);
                    return new StoredEvidence(file, publicUrl(file));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String publicUrl(Path file) {
        return evidenceBaseUrl + evidenceUrlPath + "/" + file.getFileName();
    }

    private static String trimTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    public record StoredEvidence(Path file, String url) {
    }
}
