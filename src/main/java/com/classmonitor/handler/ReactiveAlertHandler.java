package com.classmonitor.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.classmonitor.config.AlertProperties;
import com.classmonitor.security.WebSocketAuthHandler;
import com.classmonitor.security.WebSocketAuthHandler.AuthenticatedUser;
import com.classmonitor.service.ConnectionRegistry;
import com.classmonitor.validation.InputValidator;

import reactor.core.publisher.Mono;

/**
 * WebSocket handler for {@code /api/websocket/ws/alerts/{identifier}}.
 *
 * Each accepted socket is one device of the recipient. The peer only sends
 * heartbeats; alerts flow out through {@link SessionAlertConnection} until the
 * socket closes, at which point the device is unregistered.
 */
@Component
public class ReactiveAlertHandler implements WebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(ReactiveAlertHandler.class);

    private final ConnectionRegistry connectionRegistry;
    private final WebSocketAuthHandler authHandler;
    private final InputValidator inputValidator;
    private final AlertProperties alertProperties;

    public ReactiveAlertHandler(ConnectionRegistry connectionRegistry,
                                WebSocketAuthHandler authHandler,
                                InputValidator inputValidator,
                                AlertProperties alertProperties) {
        this.connectionRegistry = connectionRegistry;
        this.authHandler = authHandler;
        this.inputValidator = inputValidator;
        this.alertProperties = alertProperties;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String identifier = PathKeys.lastSegment(session.getHandshakeInfo().getUri());
        if (!inputValidator.isValidKey(identifier)) {
            logger.warn("🚫 Alert socket {} rejected: bad identifier '{}'", session.getId(), identifier);
            return session.close(CloseStatus.BAD_DATA);
        }

        return authHandler.authenticate(session.getHandshakeInfo(), session.getId())
                .map(user -> listen(session, identifier, user))
                .orElseGet(() -> session.close(CloseStatus.POLICY_VIOLATION));
    }

    private Mono<Void> listen(WebSocketSession session, String identifier, AuthenticatedUser user) {
        SessionAlertConnection connection =
                new SessionAlertConnection(session, alertProperties.getConnectionBufferSize());
        connectionRegistry.register(identifier, connection);
        logger.info("🔌 Alert socket {} open for {} (user {})", session.getId(), identifier, user.username());

        Mono<Void> output = session.send(connection.outbound());
        Mono<Void> input = session.receive()
                .doOnNext(message -> logger.trace("Heartbeat from {} on {}", identifier, session.getId()))
                .then();

        return Mono.firstWithSignal(input, output)
                .doOnError(error -> logger.debug("Alert socket {} error: {}", session.getId(), error.getMessage()))
                .onErrorResume(error -> Mono.empty())
                .doFinally(signal -> {
                    connectionRegistry.unregister(identifier, connection);
                    connection.complete();
                    logger.info("🚪 Alert socket {} closed for {}", session.getId(), identifier);
                });
    }
}
