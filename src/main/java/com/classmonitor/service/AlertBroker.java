package com.classmonitor.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.classmonitor.config.AlertProperties;
import com.classmonitor.model.AlertConnection;
import com.classmonitor.model.AlertMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Pushes alerts to every device of a recipient, plus every device of the
 * configured mirror recipient.
 *
 * Delivery is best effort and at most once per connected device: no retry, no
 * queue for offline recipients. A connection that fails a write is dropped from
 * the registry. Target and mirror are delivered independently.
 */
@Service
public class AlertBroker {

    private static final Logger logger = LoggerFactory.getLogger(AlertBroker.class);

    private final ConnectionRegistry connectionRegistry;
    private final ObjectMapper objectMapper;
    private final String mirrorIdentifier;

    public AlertBroker(ConnectionRegistry connectionRegistry,
                       ObjectMapper objectMapper,
                       AlertProperties alertProperties) {
        this.connectionRegistry = connectionRegistry;
        this.objectMapper = objectMapper;
        String mirror = alertProperties.getMirrorIdentifier();
        this.mirrorIdentifier = mirror == null || mirror.isBlank() ? null : mirror.trim();
    }

    /**
     * Deliver an alert. Never throws; an offline recipient is a normal outcome.
     */
    public DeliveryReport sendAlert(String targetIdentifier, AlertMessage message) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("Could not serialize alert for {}: {}", targetIdentifier, e.getMessage());
            return DeliveryReport.NONE;
        }

        DeliveryReport report = deliver(targetIdentifier, payload);
        if (mirrorIdentifier != null && !mirrorIdentifier.equals(targetIdentifier)) {
            report = report.plus(deliver(mirrorIdentifier, payload));
        }
        return report;
    }

    public String getMirrorIdentifier() {
        return mirrorIdentifier;
    }

    private DeliveryReport deliver(String identifier, String payload) {
        List<AlertConnection> connections = connectionRegistry.connectionsFor(identifier);
        if (connections.isEmpty()) {
            logger.info("ℹ️ {} is offline; alert not delivered live", identifier);
            return DeliveryReport.NONE;
        }

        int delivered = 0;
        int removed = 0;
        for (AlertConnection connection : connections) {
            if (sendTo(identifier, connection, payload)) {
                delivered++;
            } else if (connectionRegistry.unregister(identifier, connection)) {
                removed++;
            }
        }

        logger.info("✅ Alert delivered to {}/{} device(s) of {}", delivered, connections.size(), identifier);
        return new DeliveryReport(connections.size(), delivered, removed);
    }

    private boolean sendTo(String identifier, AlertConnection connection, String payload) {
        try {
            if (connection.trySend(payload)) {
                return true;
            }
            logger.warn("⚠️ Connection {} of {} rejected the alert; dropping it", connection.getId(), identifier);
        } catch (RuntimeException e) {
            logger.warn("⚠️ Connection {} of {} failed: {}; dropping it",
                    connection.getId(), identifier, e.getMessage());
        }
        return false;
    }

    /**
     * Counts across target and mirror for one alert.
     */
    public record DeliveryReport(int attempted, int delivered, int removed) {

        public static final DeliveryReport NONE = new DeliveryReport(0, 0, 0);

        public DeliveryReport plus(DeliveryReport other) {
            return new DeliveryReport(attempted + other.attempted,
                    delivered + other.delivered, removed + other.removed);
        }
    }
}
