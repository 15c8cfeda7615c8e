package com.classmonitor.security;

import com.classmonitor.config.HandshakePolicy;
import com.classmonitor.service.JwtService;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Optional;

/**
 * Authenticates WebSocket handshakes.
 * The token is read from the {@code token} query parameter (browsers cannot set
 * headers on a WebSocket) or from an {@code Authorization: Bearer} header.
 */
@Component
public class WebSocketAuthHandler {

    private static final Logger log = LoggerFactory.getLogger(WebSocketAuthHandler.class);

    private final JwtService jwtService;
    private final HandshakePolicy handshakePolicy;

    public WebSocketAuthHandler(JwtService jwtService,
                                @Value("${classmonitor.websocket.handshake-policy:CLOSE_ON_INVALID}")
                                HandshakePolicy handshakePolicy) {
        this.jwtService = jwtService;
        this.handshakePolicy = handshakePolicy;
        log.info("WebSocket handshake policy: {}", handshakePolicy);
    }

    /**
     * Authenticate a handshake.
     * Returns the caller, an anonymous caller when the policy allows it, or empty
     * when the connection must be closed.
     */
    public Optional<AuthenticatedUser> authenticate(HandshakeInfo handshakeInfo, String sessionId) {
        String token = extractToken(handshakeInfo);
        String failure;

        if (token == null || token.isEmpty()) {
            failure = "missing token";
        } else {
            try {
                Claims claims = jwtService.validateToken(token);
                String subject = claims.getSubject();
                if (subject != null) {
                    log.debug("WebSocket {} authenticated as {}", sessionId, subject);
                    return Optional.of(new AuthenticatedUser(subject, claims.get("role", String.class)));
                }
                failure = "token has no subject";
            } catch (JwtException e) {
                failure = e.getMessage();
            }
        }

        if (handshakePolicy == HandshakePolicy.ALLOW_ANONYMOUS) {
            log.warn("⚠️ WebSocket {} admitted anonymously ({})", sessionId, failure);
            return Optional.of(AuthenticatedUser.ANONYMOUS);
        }
        log.warn("🚫 WebSocket {} rejected: {}", sessionId, failure);
        return Optional.empty();
    }

    public HandshakePolicy getHandshakePolicy() {
        return handshakePolicy;
    }

    private String extractToken(HandshakeInfo handshakeInfo) {
        String queryToken = UriComponentsBuilder.fromUri(handshakeInfo.getUri())
                .build()
                .getQueryParams()
                .getFirst("token");
        if (queryToken != null && !queryToken.isBlank()) {
            return queryToken.trim();
        }

        return BearerTokens.fromHeaders(handshakeInfo.getHeaders());
    }

    /**
     * Authenticated user details.
     */
    public record AuthenticatedUser(String username, String role) {

        public static final AuthenticatedUser ANONYMOUS = new AuthenticatedUser("anonymous", null);

        public boolean isAnonymous() {
            return this == ANONYMOUS;
        }
    }
}
