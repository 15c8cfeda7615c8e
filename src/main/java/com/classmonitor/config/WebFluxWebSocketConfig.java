package com.classmonitor.config;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;

import com.classmonitor.handler.ReactiveAlertHandler;
import com.classmonitor.handler.ReactiveStreamViewHandler;

import reactor.netty.http.server.WebsocketServerSpec;

/**
 * Routes the viewer stream and alert sockets to their handlers on Reactor Netty.
 */
@Configuration
public class WebFluxWebSocketConfig {

    public static final String STREAM_PATH = "/api/websocket/ws/stream/{sourceKey}";
    public static final String ALERTS_PATH = "/api/websocket/ws/alerts/{identifier}";

    @Bean
    public HandlerMapping webSocketHandlerMapping(ReactiveStreamViewHandler streamViewHandler,
                                                  ReactiveAlertHandler alertHandler) {
        Map<String, WebSocketHandler> routes = new LinkedHashMap<>();
        routes.put(STREAM_PATH, streamViewHandler);
        routes.put(ALERTS_PATH, alertHandler);
        return new SimpleUrlHandlerMapping(routes, Ordered.HIGHEST_PRECEDENCE);
    }

    /**
     * Ordered ahead of the adapter WebFlux registers by default, so the frame
     * limit below applies.
     */
    @Bean
    public WebSocketHandlerAdapter handlerAdapter(WebSocketService webSocketService) {
        WebSocketHandlerAdapter adapter = new WebSocketHandlerAdapter(webSocketService);
        adapter.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return adapter;
    }

    /**
     * Frames carry base64 JPEGs, well past Netty's 64KB default frame limit.
     */
    @Bean
    public WebSocketService webSocketService(
            @Value("${classmonitor.websocket.max-frame-bytes:10485760}") int maxFrameBytes) {
        return new HandshakeWebSocketService(new ReactorNettyRequestUpgradeStrategy(
                () -> WebsocketServerSpec.builder().maxFramePayloadLength(maxFrameBytes)));
    }
}
