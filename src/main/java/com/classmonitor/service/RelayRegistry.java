package com.classmonitor.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.classmonitor.config.RelayProperties;
import com.classmonitor.model.Relay;

/**
 * Process-wide map of source key to relay. Relays are created on first use and
 * kept for the life of the process; the number of cameras is small and fixed.
 */
@Service
public class RelayRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RelayRegistry.class);

    private final Map<String, Relay> relays = new ConcurrentHashMap<>();
    private final RelayProperties relayProperties;

    public RelayRegistry(RelayProperties relayProperties) {
        this.relayProperties = relayProperties;
    }

    public Relay getOrCreate(String sourceKey) {
        return relays.computeIfAbsent(sourceKey, key -> {
            logger.info("📡 Created relay for source {}", key);
            return new Relay(key, relayProperties.getChannelCapacity());
        });
    }

    public Optional<Relay> find(String sourceKey) {
        return Optional.ofNullable(relays.get(sourceKey));
    }

    /**
     * Snapshot of all relays, safe to iterate while relays are being added.
     */
    public List<Relay> getRelays() {
        return List.copyOf(relays.values());
    }
}
