package com.classmonitor.service;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.classmonitor.model.AlertConnection;

/**
 * Live alert connections per recipient identifier. One identifier may have any
 * number of devices connected at once.
 *
 * Mutations go through {@link ConcurrentHashMap#compute}, which locks only the
 * affected identifier; an identifier whose last connection leaves is removed.
 */
@Service
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, List<AlertConnection>> connections = new ConcurrentHashMap<>();

    /**
     * Add an accepted connection under the identifier.
     * The WebSocket handshake has already completed when a handler calls this.
     */
    public void register(String identifier, AlertConnection connection) {
        connections.compute(identifier, (key, current) -> {
            List<AlertConnection> list = current != null ? current : new CopyOnWriteArrayList<>();
            if (!list.contains(connection)) {
                list.add(connection);
            }
            return list;
        });
        logger.info("📡 Connection {} registered for alerts to {} ({} device(s))",
                connection.getId(), identifier, connectionCount(identifier));
    }

    /**
     * Remove a connection; no-op if it is not registered.
     *
     * @return true if the connection was registered
     */
    public boolean unregister(String identifier, AlertConnection connection) {
        boolean[] removed = {false};
        connections.computeIfPresent(identifier, (key, list) -> {
            removed[0] = list.remove(connection);
            return list.isEmpty() ? null : list;
        });
        if (removed[0]) {
            logger.info("❌ Connection {} unregistered from {}", connection.getId(), identifier);
        }
        return removed[0];
    }

    /**
     * Point-in-time copy of the identifier's connections. Later register or
     * unregister calls do not affect a copy already handed out.
     */
    public List<AlertConnection> connectionsFor(String identifier) {
        List<AlertConnection> list = connections.get(identifier);
        return list == null ? List.of() : List.copyOf(list);
    }

    public int connectionCount(String identifier) {
        List<AlertConnection> list = connections.get(identifier);
        return list == null ? 0 : list.size();
    }

    /**
     * Identifier to live connection count, for status reporting.
     */
    public Map<String, Integer> snapshotCounts() {
        Map<String, Integer> counts = new TreeMap<>();
        connections.forEach((identifier, list) -> counts.put(identifier, list.size()));
        return counts;
    }
}
