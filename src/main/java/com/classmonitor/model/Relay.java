package com.classmonitor.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fan-out point for one camera source.
 * Holds the most recent frame and the bounded channels of every live viewer.
 */
public class Relay {

    private static final Logger logger = LoggerFactory.getLogger(Relay.class);

    private final String sourceKey;
    private final int channelCapacity;
    private final long createdAt;

    // Guards subscribers and lastFrame together so a new viewer never sees a frame twice
    private final Object lock = new Object();
    private final Set<BoundedChannel<Frame>> subscribers = new LinkedHashSet<>();
    private Frame lastFrame;

    public Relay(String sourceKey, int channelCapacity) {
        this.sourceKey = sourceKey;
        this.channelCapacity = channelCapacity;
        this.createdAt = System.currentTimeMillis();
    }

    /**
     * Register a new viewer channel. When a frame has already been broadcast,
     * the channel starts out holding it so the viewer is served immediately.
     */
    public BoundedChannel<Frame> subscribe() {
        BoundedChannel<Frame> channel = new BoundedChannel<>(channelCapacity);
        synchronized (lock) {
            if (lastFrame != null) {
                channel.trySend(lastFrame);
            }
            subscribers.add(channel);
        }
        return channel;
    }

    /**
     * Remove a viewer channel. No-op if it is not registered.
     */
    public void unsubscribe(BoundedChannel<Frame> channel) {
        boolean removed;
        synchronized (lock) {
            removed = subscribers.remove(channel);
        }
        if (removed) {
            channel.close();
        }
    }

    /**
     * Cache the frame and offer it to every subscriber. A full channel misses
     * this frame; nothing here waits on a subscriber.
     *
     * Sends happen outside the lock: handing a frame to a waiting viewer runs
     * that viewer's downstream inline, and it may unsubscribe from there.
     *
     * @return number of subscribers that accepted the frame
     */
    public int broadcast(Frame frame) {
        List<BoundedChannel<Frame>> targets;
        synchronized (lock) {
            lastFrame = frame;
            targets = List.copyOf(subscribers);
        }
        int delivered = 0;
        for (BoundedChannel<Frame> channel : targets) {
            try {
                if (channel.trySend(frame)) {
                    delivered++;
                }
            } catch (RuntimeException e) {
                logger.warn("Viewer of source {} failed while taking a frame: {}", sourceKey, e.toString());
            }
        }
        return delivered;
    }

    public Optional<Frame> getLastFrame() {
        synchronized (lock) {
            return Optional.ofNullable(lastFrame);
        }
    }

    public int getSubscriberCount() {
        synchronized (lock) {
            return subscribers.size();
        }
    }

    public boolean hasSubscribers() {
        return getSubscriberCount() > 0;
    }

    public String getSourceKey() {
        return sourceKey;
    }

    public long getCreatedAt() {
        return createdAt;
    }
}
