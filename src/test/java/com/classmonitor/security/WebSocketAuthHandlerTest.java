package com.classmonitor.security;

import com.classmonitor.config.HandshakePolicy;
import com.classmonitor.security.WebSocketAuthHandler.AuthenticatedUser;
import com.classmonitor.service.JwtService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.HandshakeInfo;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WebSocketAuthHandlerTest {

    private static final String SECRET = "test-secret-key-that-is-long-enough-for-hs256-signing";

    private final JwtService jwtService = new JwtService(SECRET, 60_000, "classmonitor");

    private static HandshakeInfo handshake(String query, HttpHeaders headers) {
        URI uri = URI.create("ws://localhost/api/websocket/ws/stream/room-7" + (query == null ? "" : "?" + query));
        return new HandshakeInfo(uri, headers, Mono.empty(), null);
    }

    @Test
    @DisplayName("accepts a valid token from the query string")
    void tokenFromQuery() {
        WebSocketAuthHandler handler = new WebSocketAuthHandler(jwtService, HandshakePolicy.CLOSE_ON_INVALID);
        String token = jwtService.generateAccessToken("teacher-5", "TEACHER");

        Optional<AuthenticatedUser> user = handler.authenticate(handshake("token=" + token, new HttpHeaders()), "s1");

        assertEquals(Optional.of(new AuthenticatedUser("teacher-5", "TEACHER")), user);
    }

    @Test
    @DisplayName("accepts a valid token from the Authorization header")
    void tokenFromHeader() {
        WebSocketAuthHandler handler = new WebSocketAuthHandler(jwtService, HandshakePolicy.CLOSE_ON_INVALID);
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(jwtService.generateAccessToken("admin-1", "ADMIN"));

        Optional<AuthenticatedUser> user = handler.authenticate(handshake(null, headers), "s2");

        assertTrue(user.isPresent());
        assertEquals("admin-1", user.get().username());
        assertFalse(user.get().isAnonymous());
    }

    @Test
    @DisplayName("rejects missing, forged and foreign tokens when closing on invalid")
    void rejectsInvalidTokens() {
        WebSocketAuthHandler handler = new WebSocketAuthHandler(jwtService, HandshakePolicy.CLOSE_ON_INVALID);
        JwtService otherIssuer = new JwtService(SECRET, 60_000, "someone-else");
        JwtService otherKey = new JwtService("another-secret-key-that-is-long-enough-too", 60_000, "classmonitor");

        assertTrue(handler.authenticate(handshake(null, new HttpHeaders()), "s3").isEmpty());
        assertTrue(handler.authenticate(handshake("token=garbage", new HttpHeaders()), "s4").isEmpty());
        assertTrue(handler.authenticate(
                handshake("token=" + otherIssuer.generateAccessToken("x", "ADMIN"), new HttpHeaders()), "s5").isEmpty());
        assertTrue(handler.authenticate(
                handshake("token=" + otherKey.generateAccessToken("x", "ADMIN"), new HttpHeaders()), "s6").isEmpty());
    }

    @Test
    @DisplayName("admits anonymous callers when the policy allows it")
    void anonymousPolicy() {
        WebSocketAuthHandler handler = new WebSocketAuthHandler(jwtService, HandshakePolicy.ALLOW_ANONYMOUS);

        Optional<AuthenticatedUser> user = handler.authenticate(handshake("token=garbage", new HttpHeaders()), "s7");

        assertTrue(user.isPresent());
        assertTrue(user.get().isAnonymous());
    }

    @Test
    void expiredTokenIsRejected() {
        JwtService shortLived = new JwtService(SECRET, -1_000, "classmonitor");
        WebSocketAuthHandler handler = new WebSocketAuthHandler(jwtService, HandshakePolicy.CLOSE_ON_INVALID);

        String token = shortLived.generateAccessToken("teacher-5", "TEACHER");

        assertFalse(jwtService.isTokenValid(token));
        assertTrue(handler.authenticate(handshake("token=" + token, new HttpHeaders()), "s8").isEmpty());
    }
}
