package com.classmonitor.controller;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.classmonitor.model.AlertEvent;
import com.classmonitor.model.Relay;
import com.classmonitor.repository.AlertEventRepository;
import com.classmonitor.security.WebSocketAuthHandler;
import com.classmonitor.service.AlertBroker;
import com.classmonitor.service.ConnectionRegistry;
import com.classmonitor.service.FramePullerService;
import com.classmonitor.service.RelayRegistry;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only view of relays, pullers, alert connections and recorded alerts.
 */
@RestController
public class RelayStatusController {

    private static final Logger logger = LoggerFactory.getLogger(RelayStatusController.class);

    private final RelayRegistry relayRegistry;
    private final FramePullerService pullerService;
    private final ConnectionRegistry connectionRegistry;
    private final AlertBroker alertBroker;
    private final AlertEventRepository alertEventRepository;
    private final WebSocketAuthHandler webSocketAuthHandler;

    public RelayStatusController(RelayRegistry relayRegistry,
                                 FramePullerService pullerService,
                                 ConnectionRegistry connectionRegistry,
                                 AlertBroker alertBroker,
                                 AlertEventRepository alertEventRepository,
                                 WebSocketAuthHandler webSocketAuthHandler) {
        this.relayRegistry = relayRegistry;
        this.pullerService = pullerService;
        this.connectionRegistry = connectionRegistry;
        this.alertBroker = alertBroker;
        this.alertEventRepository = alertEventRepository;
        this.webSocketAuthHandler = webSocketAuthHandler;
    }

    @GetMapping("/api/relay/status")
    public Mono<Map<String, Object>> getStatus() {
        return Mono.fromCallable(() -> {
            List<Map<String, Object>> relays = new ArrayList<>();
            for (Relay relay : relayRegistry.getRelays()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("sourceKey", relay.getSourceKey());
                entry.put("subscribers", relay.getSubscriberCount());
                entry.put("hasCachedFrame", relay.getLastFrame().isPresent());
                entry.put("createdAt", Instant.ofEpochMilli(relay.getCreatedAt()));
                entry.put("puller", pullerService.getState(relay.getSourceKey()));
                entry.put("consecutiveFailures", pullerService.getConsecutiveFailures(relay.getSourceKey()));
                relays.add(entry);
            }

            Map<String, Object> status = new LinkedHashMap<>();
            status.put("relays", relays);
            status.put("activePullers", pullerService.getActivePullerCount());
            status.put("alertConnections", connectionRegistry.snapshotCounts());
            status.put("mirrorIdentifier", alertBroker.getMirrorIdentifier());
            status.put("handshakePolicy", webSocketAuthHandler.getHandshakePolicy());
            return status;
        });
    }

    /**
     * Recorded alerts, newest first.
     */
    @GetMapping("/api/admin/alert-events")
    public Flux<AlertEvent> getAlertEvents(
            @RequestParam(required = false) String sourceKey,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        if (sourceKey != null && !sourceKey.isBlank()) {
            logger.info("Admin: Retrieving alert events for source {}", sourceKey);
            return alertEventRepository.findBySourceKeyOrderByCreatedAtDesc(sourceKey);
        }
        logger.info("Admin: Retrieving alert events (limit={}, offset={})", limit, offset);
        return alertEventRepository.findRecentEvents(Math.min(limit, 1000), offset);
    }
}
