package com.classmonitor.service;

import java.net.URI;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import io.netty.channel.ChannelOption;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * HTTP client for one camera's snapshot endpoint.
 *
 * Owns a private connection pool, released by {@link #dispose()}. A puller
 * acquires one when it starts and disposes it when it stops.
 */
public class CameraSnapshotClient implements Disposable {

    private static final Logger logger = LoggerFactory.getLogger(CameraSnapshotClient.class);

    private final ConnectionProvider connectionProvider;
    private final WebClient webClient;
    private final Duration requestTimeout;
    private final String snapshotPath;

    public CameraSnapshotClient(String sourceKey, Duration requestTimeout, String snapshotPath, int maxSnapshotBytes) {
        this.requestTimeout = requestTimeout;
        this.snapshotPath = snapshotPath.startsWith("/") ? snapshotPath : "/" + snapshotPath;
        this.connectionProvider = ConnectionProvider.builder("camera-" + sourceKey)
                .maxConnections(1)
                .pendingAcquireTimeout(requestTimeout)
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) requestTimeout.toMillis())
                .responseTimeout(requestTimeout);

        this.webClient = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxSnapshotBytes))
                .build();
    }

    /**
     * GET one image from the camera.
     *
     * @return the image bytes, or empty for a non-2xx status or an empty body.
     *         A device address that does not form a valid URI fails the Mono
     *         with {@link IllegalArgumentException}.
     */
    public Mono<byte[]> fetchSnapshot(String deviceAddress) {
        return Mono.fromCallable(() -> snapshotUri(deviceAddress))
                .doOnError(IllegalArgumentException.class, e ->
                        logger.warn("⚠️ Device address '{}' is not a valid camera URL: {}", deviceAddress, e.getMessage()))
                .flatMap(this::get);
    }

    private Mono<byte[]> get(URI uri) {
        return webClient.get()
                .uri(uri)
                .exchangeToMono(response -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                        logger.debug("Camera {} answered {}", uri, response.statusCode().value());
                        return response.releaseBody().then(Mono.<byte[]>empty());
                    }
                    return response.bodyToMono(byte[].class);
                })
                .filter(body -> body.length > 0)
                .timeout(requestTimeout);
    }

    URI snapshotUri(String deviceAddress) {
        String base = deviceAddress.contains("://") ? deviceAddress : "http://" + deviceAddress;
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + snapshotPath);
    }

    @Override
    public void dispose() {
        connectionProvider.dispose();
    }

    @Override
    public boolean isDisposed() {
        return connectionProvider.isDisposed();
    }
}
