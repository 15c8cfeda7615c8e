package com.classmonitor.service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.classmonitor.config.RelayProperties;
import com.classmonitor.model.Frame;
import com.classmonitor.model.Prediction;
import com.classmonitor.model.Relay;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Runs one background puller per camera source.
 *
 * A puller polls its camera only while the relay has viewers, broadcasting each
 * image it gets. Failures are retried with a backoff; the loop only ends when
 * the puller is stopped.
 *
 * A failed attempt yields no frame: no registered device, an unreachable
 * camera, a non-2xx answer or a body that is not a JPEG. The first one in a
 * row is logged at DEBUG, the second at WARN, and every
 * {@value #FAILURE_REPEAT_WARN_EVERY}th after that at WARN again.
 */
@Service
public class FramePullerService {

    private static final Logger logger = LoggerFactory.getLogger(FramePullerService.class);

    static final int FAILURE_REPEAT_WARN_EVERY = 30;

    private final Map<String, PullerTask> pullers = new ConcurrentHashMap<>();

    private final RelayRegistry relayRegistry;
    private final ClassroomDirectoryService classroomDirectory;
    private final CameraSnapshotClientFactory clientFactory;
    private final DetectionEngine detectionEngine;
    private final RelayProperties relayProperties;

    public FramePullerService(RelayRegistry relayRegistry,
                              ClassroomDirectoryService classroomDirectory,
                              CameraSnapshotClientFactory clientFactory,
                              DetectionEngine detectionEngine,
                              RelayProperties relayProperties) {
        this.relayRegistry = relayRegistry;
        this.classroomDirectory = classroomDirectory;
        this.clientFactory = clientFactory;
        this.detectionEngine = detectionEngine;
        this.relayProperties = relayProperties;
    }

    /**
     * Start a puller for the source unless one is already running.
     * Cheap and safe to call on every new subscription.
     *
     * @return true if a new puller was started by this call
     */
    public boolean ensureRunning(String sourceKey) {
        PullerTask candidate = new PullerTask(sourceKey);
        PullerTask current = pullers.compute(sourceKey,
                (key, existing) -> existing != null && existing.isRunning() ? existing : candidate);
        if (current != candidate) {
            return false;
        }
        logger.info("▶️ Starting frame puller for source {}", sourceKey);
        candidate.start(pullLoop(candidate));
        return true;
    }

    /**
     * Stop the puller for a source, releasing its HTTP client.
     */
    public void stop(String sourceKey) {
        PullerTask task = pullers.remove(sourceKey);
        if (task != null) {
            task.stop();
        }
    }

    public PullerState getState(String sourceKey) {
        PullerTask task = pullers.get(sourceKey);
        if (task == null) {
            return PullerState.ABSENT;
        }
        return task.isRunning() ? PullerState.RUNNING : PullerState.STOPPED;
    }

    /**
     * Attempts in a row that produced no frame, or 0 when no puller runs.
     */
    public int getConsecutiveFailures(String sourceKey) {
        PullerTask task = pullers.get(sourceKey);
        return task == null ? 0 : task.failures.get();
    }

    public int getActivePullerCount() {
        return (int) pullers.values().stream().filter(PullerTask::isRunning).count();
    }

    /**
     * Restart any puller that died while its relay still has viewers.
     */
    @Scheduled(fixedDelayString = "${classmonitor.relay.liveness-check-interval:10000}")
    public void superviseActiveRelays() {
        for (Relay relay : relayRegistry.getRelays()) {
            if (relay.hasSubscribers() && ensureRunning(relay.getSourceKey())) {
                logger.warn("⚠️ Frame puller for source {} was not running; restarted", relay.getSourceKey());
            }
        }
    }

    @PreDestroy
    public void stopAll() {
        List<String> keys = List.copyOf(pullers.keySet());
        keys.forEach(this::stop);
        if (!keys.isEmpty()) {
            logger.info("⏹️ Stopped {} frame puller(s)", keys.size());
        }
    }

    private Mono<Void> pullLoop(PullerTask task) {
        String sourceKey = task.sourceKey;
        Relay relay = relayRegistry.getOrCreate(sourceKey);
        return Mono.using(
                () -> clientFactory.create(sourceKey),
                client -> Mono.defer(() -> pollOnce(task, relay, client))
                        .onErrorResume(error -> {
                            int failures = task.failures.incrementAndGet();
                            logger.warn("Frame puller for source {} failed ({} in a row): {}",
                                    sourceKey, failures, error.toString());
                            return Mono.just(millis(relayProperties.getErrorBackoff()));
                        })
                        .flatMap(Mono::delay)
                        .repeat()
                        .then(),
                CameraSnapshotClient::dispose);
    }

    /**
     * One iteration of the loop.
     *
     * @return how long to wait before the next iteration
     */
    private Mono<Duration> pollOnce(PullerTask task, Relay relay, CameraSnapshotClient client) {
        String sourceKey = task.sourceKey;
        if (!relay.hasSubscribers()) {
            return Mono.just(millis(relayProperties.getIdleInterval()));
        }
        return classroomDirectory.resolveDeviceAddress(sourceKey)
                .flatMap(client::fetchSnapshot)
                .filter(this::looksLikeJpeg)
                .flatMap(jpeg -> detect(sourceKey, jpeg)
                        .map(predictions -> Frame.fromJpeg(sourceKey, jpeg, predictions)))
                .map(frame -> {
                    int previousFailures = task.failures.getAndSet(0);
                    if (previousFailures > 1) {
                        logger.info("✅ Source {} is producing frames again after {} failed attempts",
                                sourceKey, previousFailures);
                    }
                    int delivered = relay.broadcast(frame);
                    logger.debug("📤 Frame from source {} delivered to {}/{} viewers",
                            sourceKey, delivered, relay.getSubscriberCount());
                    return millis(relayProperties.getFrameInterval());
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    logNoFrame(sourceKey, task.failures.incrementAndGet());
                    return millis(relayProperties.getFailureBackoff());
                }));
    }

    private void logNoFrame(String sourceKey, int failures) {
        if (failures == 2 || (failures > 2 && failures % FAILURE_REPEAT_WARN_EVERY == 0)) {
            logger.warn("⚠️ No frame from source {} for {} attempts in a row; is the camera reachable?",
                    sourceKey, failures);
        } else {
            logger.debug("No frame from source {} ({} in a row); backing off", sourceKey, failures);
        }
    }

    private Mono<List<Prediction>> detect(String sourceKey, byte[] jpeg) {
        return detectionEngine.detect(jpeg)
                .defaultIfEmpty(List.of())
                .onErrorResume(error -> {
                    logger.warn("Detection failed for source {}: {}", sourceKey, error.getMessage());
                    return Mono.just(List.of());
                });
    }

    // JPEG starts with the SOI marker FF D8
    private boolean looksLikeJpeg(byte[] body) {
        return body.length > 2 && (body[0] & 0xFF) == 0xFF && (body[1] & 0xFF) == 0xD8;
    }

    private static Duration millis(long value) {
        return Duration.ofMillis(value);
    }

    public enum PullerState {
        ABSENT,
        RUNNING,
        STOPPED
    }

    private final class PullerTask {
        private final String sourceKey;
        private final AtomicInteger failures = new AtomicInteger();
        private volatile Disposable subscription;
        private volatile boolean stopped;

        private PullerTask(String sourceKey) {
            this.sourceKey = sourceKey;
        }

        private void start(Mono<Void> loop) {
            Disposable disposable = loop
                    .doFinally(signal -> {
                        stopped = true;
                        pullers.remove(sourceKey, this);
                        logger.info("⏹️ Frame puller for source {} ended ({})", sourceKey, signal);
                    })
                    .subscribe(
                            ignored -> { },
                            error -> logger.error("Frame puller for source {} terminated: {}",
                                    sourceKey, error.getMessage(), error));
            subscription = disposable;
            if (stopped) {
                disposable.dispose();
            }
        }

        private void stop() {
            stopped = true;
            Disposable disposable = subscription;
            if (disposable != null) {
                disposable.dispose();
            }
        }

        private boolean isRunning() {
            return !stopped;
        }
    }
}
