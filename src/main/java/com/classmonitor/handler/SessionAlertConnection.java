package com.classmonitor.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.classmonitor.model.AlertConnection;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * Alert connection backed by a WebSocket session.
 * Writes go through a bounded sink that the session drains; a closed session,
 * a full sink or a terminated sink counts as a failed write.
 *
 * The unicast sink accepts one emitter at a time, so emissions are serialized
 * on this connection. Alerts for the same device may arrive from several
 * request threads at once.
 */
public class SessionAlertConnection implements AlertConnection {

    private static final Logger logger = LoggerFactory.getLogger(SessionAlertConnection.class);

    private final WebSocketSession session;
    private final Sinks.Many<WebSocketMessage> outbound;
    private final Object emitLock = new Object();

    public SessionAlertConnection(WebSocketSession session, int bufferSize) {
        this.session = session;
        this.outbound = Sinks.many().unicast()
                .onBackpressureBuffer(Queues.<WebSocketMessage>get(bufferSize).get());
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean trySend(String payload) {
        if (!session.isOpen()) {
            return false;
        }
        WebSocketMessage message = session.textMessage(payload);
        Sinks.EmitResult result;
        synchronized (emitLock) {
            result = outbound.tryEmitNext(message);
        }
        if (result.isFailure()) {
            logger.debug("Alert write to session {} rejected: {}", session.getId(), result);
        }
        return result.isSuccess();
    }

    public Flux<WebSocketMessage> outbound() {
        return outbound.asFlux();
    }

    public void complete() {
        synchronized (emitLock) {
            outbound.tryEmitComplete();
        }
    }
}
