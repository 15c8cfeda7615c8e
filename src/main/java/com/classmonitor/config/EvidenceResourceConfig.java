package com.classmonitor.config;

import java.nio.file.Paths;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.FileSystemResource;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;

/**
 * Serves stored violation evidence so alert recipients can open the image URL.
 */
@Configuration
public class EvidenceResourceConfig {

    @Bean
    public RouterFunction<ServerResponse> evidenceResources(AlertProperties alertProperties) {
        String urlPath = alertProperties.getEvidenceUrlPath();
        String pattern = (urlPath.endsWith("/") ? urlPath : urlPath + "/") + "**";
        String directory = Paths.get(alertProperties.getEvidenceDirectory()).toAbsolutePath() + "/";
        return RouterFunctions.resources(pattern, new FileSystemResource(directory));
    }
}
