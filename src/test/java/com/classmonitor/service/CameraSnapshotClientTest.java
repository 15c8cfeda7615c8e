package com.classmonitor.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CameraSnapshotClientTest {

    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0x01, 0x02};

    private DisposableServer camera;
    private CameraSnapshotClient client;
    private String address;

    @BeforeEach
    void setUp() {
        camera = HttpServer.create()
                .host("127.0.0.1")
                .port(0)
                .route(routes -> routes
                        .get("/capture", (request, response) -> response.sendByteArray(Mono.just(JPEG)))
                        .get("/missing/capture", (request, response) -> response.status(404).send())
                        .get("/empty/capture", (request, response) -> response.status(200).send())
                        .get("/stuck/capture", (request, response) -> Mono.never()))
                .bindNow();
        address = "127.0.0.1:" + camera.port();
        client = new CameraSnapshotClient("room-7", Duration.ofMillis(500), "/capture", 1024 * 1024);
    }

    @AfterEach
    void tearDown() {
        client.dispose();
        camera.disposeNow();
    }

    @Test
    @DisplayName("returns the image body on 200")
    void fetchesImage() {
        StepVerifier.create(client.fetchSnapshot(address))
                .assertNext(body -> assertArrayEquals(JPEG, body))
                .verifyComplete();
    }

    @Test
    @DisplayName("treats a non-2xx status as no image")
    void notFoundIsEmpty() {
        StepVerifier.create(client.fetchSnapshot(address + "/missing"))
                .verifyComplete();
    }

    @Test
    @DisplayName("treats an empty body as no image")
    void emptyBodyIsEmpty() {
        StepVerifier.create(client.fetchSnapshot(address + "/empty"))
                .verifyComplete();
    }

    @Test
    @DisplayName("fails when the camera does not answer in time")
    void slowCameraTimesOut() {
        StepVerifier.create(client.fetchSnapshot(address + "/stuck"))
                .expectError()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("a malformed device address fails the Mono instead of throwing")
    void malformedAddressFailsLazily() {
        Mono<byte[]> snapshot = assertDoesNotThrow(() -> client.fetchSnapshot("bad host^"));

        StepVerifier.create(snapshot)
                .expectError(IllegalArgumentException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void buildsSnapshotUri() {
        assertEquals("http://10.0.0.5/capture", client.snapshotUri("10.0.0.5").toString());
        assertEquals("http://10.0.0.5:8080/capture", client.snapshotUri("10.0.0.5:8080/").toString());
        assertEquals("https://cam.local/capture", client.snapshotUri("https://cam.local").toString());
    }

    @Test
    void disposeReleasesPool() {
        assertFalse(client.isDisposed());
        client.dispose();
        assertTrue(client.isDisposed());
    }
}
