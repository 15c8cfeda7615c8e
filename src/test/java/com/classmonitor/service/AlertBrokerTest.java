package com.classmonitor.service;

import com.classmonitor.config.AlertProperties;
import com.classmonitor.model.AlertConnection;
import com.classmonitor.model.AlertMessage;
import com.classmonitor.service.AlertBroker.DeliveryReport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class AlertBrokerTest {

    private static final String TARGET = "teacher-5";
    private static final String MIRROR = "admin-1";

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private ConnectionRegistry registry;
    private AlertBroker broker;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        broker = brokerWithMirror(MIRROR);
    }

    private AlertBroker brokerWithMirror(String mirror) {
        AlertProperties properties = new AlertProperties();
        properties.setMirrorIdentifier(mirror);
        return new AlertBroker(registry, objectMapper, properties);
    }

    private static AlertMessage alert() {
        return new AlertMessage("🚨 Phone detected", "Phone detected", "http://localhost:8080/uploads/evidence/v.jpg",
                Instant.parse("2026-01-01T09:00:00Z"), "7");
    }

    @Nested
    @DisplayName("fan-out")
    class FanOut {

        @Test
        @DisplayName("reaches every device of the target and of the mirror")
        void targetAndMirror() throws Exception {
            RecordingConnection phone = new RecordingConnection("phone", true);
            RecordingConnection laptop = new RecordingConnection("laptop", true);
            RecordingConnection dashboard = new RecordingConnection("dashboard", true);
            registry.register(TARGET, phone);
            registry.register(TARGET, laptop);
            registry.register(MIRROR, dashboard);

            DeliveryReport report = broker.sendAlert(TARGET, alert());

            assertEquals(new DeliveryReport(3, 3, 0), report);
            for (RecordingConnection connection : List.of(phone, laptop, dashboard)) {
                assertEquals(1, connection.payloads.size());
            }
            JsonNode json = objectMapper.readTree(phone.payloads.get(0));
            assertEquals("Phone detected", json.get("detail").asText());
            assertEquals("7", json.get("sourceKey").asText());
            assertEquals(phone.payloads.get(0), dashboard.payloads.get(0));
        }

        @Test
        @DisplayName("does not deliver twice when the target is the mirror")
        void targetIsMirror() {
            RecordingConnection dashboard = new RecordingConnection("dashboard", true);
            registry.register(MIRROR, dashboard);

            DeliveryReport report = broker.sendAlert(MIRROR, alert());

            assertEquals(1, report.attempted());
            assertEquals(1, dashboard.payloads.size());
        }

        @Test
        @DisplayName("an offline recipient is not an error")
        void nobodyConnected() {
            DeliveryReport report = assertDoesNotThrow(() -> broker.sendAlert(TARGET, alert()));

            assertEquals(DeliveryReport.NONE, report);
        }

        @Test
        @DisplayName("a blank mirror identifier disables mirroring")
        void mirrorDisabled() {
            AlertBroker unmirrored = brokerWithMirror(" ");
            RecordingConnection dashboard = new RecordingConnection("dashboard", true);
            registry.register(MIRROR, dashboard);
            registry.register(TARGET, new RecordingConnection("phone", true));

            DeliveryReport report = unmirrored.sendAlert(TARGET, alert());

            assertNull(unmirrored.getMirrorIdentifier());
            assertEquals(1, report.delivered());
            assertTrue(dashboard.payloads.isEmpty());
        }
    }

    @Nested
    @DisplayName("failed connections")
    class FailedConnections {

        @Test
        @DisplayName("a dead device is dropped without affecting the others or the mirror")
        void deadDeviceIsDropped() {
            RecordingConnection phone = new RecordingConnection("phone", true);
            RecordingConnection dead = new RecordingConnection("dead", false);
            RecordingConnection laptop = new RecordingConnection("laptop", true);
            RecordingConnection dashboard = new RecordingConnection("dashboard", true);
            registry.register(TARGET, phone);
            registry.register(TARGET, dead);
            registry.register(TARGET, laptop);
            registry.register(MIRROR, dashboard);

            DeliveryReport report = broker.sendAlert(TARGET, alert());

            assertEquals(new DeliveryReport(4, 3, 1), report);
            assertEquals(List.of(phone, laptop), registry.connectionsFor(TARGET));
            assertEquals(1, dashboard.payloads.size());
        }

        @Test
        @DisplayName("a connection that throws is treated as dead")
        void throwingConnection() {
            AlertConnection broken = new AlertConnection() {
                @Override
                public String getId() {
                    return "broken";
                }

                @Override
                public boolean trySend(String payload) {
                    throw new IllegalStateException("socket reset");
                }
            };
            RecordingConnection phone = new RecordingConnection("phone", true);
            registry.register(TARGET, broken);
            registry.register(TARGET, phone);

            DeliveryReport report = broker.sendAlert(TARGET, alert());

            assertEquals(1, report.delivered());
            assertEquals(1, report.removed());
            assertEquals(List.of(phone), registry.connectionsFor(TARGET));
        }

        @Test
        @DisplayName("an identifier whose only device died is forgotten")
        void lastDeviceDies() {
            registry.register(TARGET, new RecordingConnection("dead", false));

            broker.sendAlert(TARGET, alert());

            assertEquals(0, registry.connectionCount(TARGET));
            assertFalse(registry.snapshotCounts().containsKey(TARGET));
        }
    }

    static final class RecordingConnection implements AlertConnection {
        private final String id;
        private final boolean alive;
        final List<String> payloads = new CopyOnWriteArrayList<>();

        RecordingConnection(String id, boolean alive) {
            this.id = id;
            this.alive = alive;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public boolean trySend(String payload) {
            if (!alive) {
                return false;
            }
            payloads.add(payload);
            return true;
        }
    }
}
