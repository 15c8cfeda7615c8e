package com.classmonitor.handler;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.classmonitor.config.RelayProperties;
import com.classmonitor.dto.StreamMessage;
import com.classmonitor.model.BoundedChannel;
import com.classmonitor.model.Frame;
import com.classmonitor.model.Relay;
import com.classmonitor.security.WebSocketAuthHandler;
import com.classmonitor.service.FramePullerService;
import com.classmonitor.service.RelayRegistry;
import com.classmonitor.validation.InputValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * WebSocket handler for {@code /api/websocket/ws/stream/{sourceKey}}.
 *
 * Each viewer gets its own bounded channel on the source's relay. The cached
 * frame (if any) goes out first, then live frames; when nothing arrives within
 * the keepalive interval a keepalive message is sent instead.
 */
@Component
public class ReactiveStreamViewHandler implements WebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(ReactiveStreamViewHandler.class);

    private final RelayRegistry relayRegistry;
    private final FramePullerService pullerService;
    private final WebSocketAuthHandler authHandler;
    private final InputValidator inputValidator;
    private final RelayProperties relayProperties;
    private final ObjectMapper objectMapper;

    public ReactiveStreamViewHandler(RelayRegistry relayRegistry,
                                     FramePullerService pullerService,
                                     WebSocketAuthHandler authHandler,
                                     InputValidator inputValidator,
                                     RelayProperties relayProperties,
                                     ObjectMapper objectMapper) {
        this.relayRegistry = relayRegistry;
        this.pullerService = pullerService;
        this.authHandler = authHandler;
        this.inputValidator = inputValidator;
        this.relayProperties = relayProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String sourceKey = PathKeys.lastSegment(session.getHandshakeInfo().getUri());
        if (!inputValidator.isValidKey(sourceKey)) {
            logger.warn("🚫 Viewer {} rejected: bad source key '{}'", session.getId(), sourceKey);
            return session.close(CloseStatus.BAD_DATA);
        }

        return authHandler.authenticate(session.getHandshakeInfo(), session.getId())
                .map(user -> stream(session, sourceKey))
                .orElseGet(() -> session.close(CloseStatus.POLICY_VIOLATION));
    }

    private Mono<Void> stream(WebSocketSession session, String sourceKey) {
        Relay relay = relayRegistry.getOrCreate(sourceKey);
        BoundedChannel<Frame> channel = relay.subscribe();
        pullerService.ensureRunning(sourceKey);
        logger.info("📺 Viewer {} joined source {} (Total: {})", session.getId(), sourceKey, relay.getSubscriberCount());

        Duration keepalive = Duration.ofMillis(relayProperties.getKeepaliveInterval());
        Flux<WebSocketMessage> outbound = channel.receive(keepalive)
                .repeat()
                .map(received -> received.isTimeout()
                        ? StreamMessage.keepalive(sourceKey)
                        : StreamMessage.frame(received.item()))
                .map(message -> session.textMessage(toJson(message)));

        Mono<Void> output = session.send(outbound);
        Mono<Void> input = session.receive().then();

        return Mono.firstWithSignal(output, input)
                .doOnError(error -> logger.debug("Viewer {} error: {}", session.getId(), error.getMessage()))
                .onErrorResume(error -> Mono.empty())
                .doFinally(signal -> {
                    relay.unsubscribe(channel);
                    logger.info("🚪 Viewer {} left source {} (Remaining: {})",
                            session.getId(), sourceKey, relay.getSubscriberCount());
                });
    }

    private String toJson(StreamMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize stream message", e);
        }
    }
}
