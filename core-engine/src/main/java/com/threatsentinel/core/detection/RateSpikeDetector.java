package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.DetectionRule;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rate-spike detector.
 *
 * <p>
 * Detects when the number of matching events for a given key (source IP,
 * user, session or a payload field) exceeds a configured threshold within a
 * sliding time window. Card testing and credential brute force are both
 * expressed as rate rules.
 * </p>
 *
 * <h3>Implementation</h3>
 * <p>
 * Keeps one deque of event timestamps (epoch millis) per key. On each
 * evaluation the key's deque is pruned to the current window, the new event
 * is recorded, and a count check is performed. Keys that went idle are
 * swept periodically.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Every update of a key's deque happens inside
 * {@link ConcurrentHashMap#compute}, so concurrent events for the same key
 * are serialised while different keys proceed in parallel.
 * </p>
 *
 * @since 1.0.0
 */
public class RateSpikeDetector implements ThreatDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RateSpikeDetector.class);

    /** Upper bound on timestamps retained per key. */
    static final int MAX_TRACKED_PER_KEY = 10_000;

    /** Idle keys are swept once every this many evaluations. */
    static final int SWEEP_EVERY = 1_024;

    private final DetectionRule rule;
    private final Severity severity;
    private final String keyField;
    private final int windowSeconds;
    private final double threshold;

    /** Sliding window of event timestamps (epoch millis), per key. */
    private final Map<String, Deque<Long>> windows = new ConcurrentHashMap<>();

    private final AtomicLong evaluations = new AtomicLong();

    /**
     * @param rule the detection rule configuration
     * @throws NullPointerException     if {@code rule} or its key field is
     *                                  {@code null}
     * @throws IllegalArgumentException if {@code windowSeconds} or
     *                                  {@code threshold} are invalid
     */
    public RateSpikeDetector(DetectionRule rule) {
        this.rule = Objects.requireNonNull(rule, "DetectionRule must not be null");
        String ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.keyField = Objects.requireNonNull(rule.getKeyField(),
                "keyField must not be null for rate rule '" + ruleName + "'");
        this.severity = rule.severityLevel();
        this.windowSeconds = rule.getWindowSeconds();
        this.threshold = rule.getThreshold();

        if (windowSeconds <= 0) {
            throw new IllegalArgumentException(
                    "windowSeconds must be > 0 for rule '" + ruleName + "', got: " + windowSeconds);
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException(
                    "threshold must be > 0 for rule '" + ruleName + "', got: " + threshold);
        }
    }

    @Override
    public Optional<Detection> evaluate(SecurityEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        if (!rule.appliesTo(event.getEventType())) {
            return Optional.empty();
        }
        Optional<String> key = event.resolve(keyField);
        if (key.isEmpty()) {
            LOG.trace("Rule [{}]: key '{}' absent, skipping", rule.getName(), keyField);
            return Optional.empty();
        }

        long now = event.getReceivedAt() != null
                ? event.getReceivedAt().toEpochMilli()
                : System.currentTimeMillis();
        long windowStart = now - (windowSeconds * 1_000L);

        int[] count = new int[1];
        windows.compute(key.get(), (k, timestamps) -> {
            Deque<Long> dq = timestamps != null ? timestamps : new ArrayDeque<>();
            while (!dq.isEmpty() && dq.peekFirst() < windowStart) {
                dq.pollFirst();
            }
            dq.addLast(now);
            if (dq.size() > MAX_TRACKED_PER_KEY) {
                dq.pollFirst();
            }
            count[0] = dq.size();
            return dq;
        });

        if (evaluations.incrementAndGet() % SWEEP_EVERY == 0) {
            evictIdleKeys(now);
        }

        if (count[0] > threshold) {
            LOG.debug("Rule [{}] fired: {}={} count={} > threshold={}",
                    rule.getName(), keyField, key.get(), count[0], threshold);
            return Optional.of(Detection.builder()
                    .attackType(rule.getAttackType())
                    .severity(severity)
                    .detectorName(rule.getName())
                    .description(String.format(
                            "Rate spike: %d '%s' events for %s=%s in %d seconds (threshold: %.0f)",
                            count[0], event.getEventType(), keyField, key.get(), windowSeconds, threshold))
                    .evidence("key", key.get())
                    .evidence("count", count[0])
                    .evidence("window_start", Instant.ofEpochMilli(windowStart).toString())
                    .build());
        }
        return Optional.empty();
    }

    /**
     * Drop keys whose newest timestamp is older than the window.
     *
     * @param now reference time (epoch millis)
     */
    void evictIdleKeys(long now) {
        long windowStart = now - (windowSeconds * 1_000L);
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, dq) -> {
                Long newest = dq.peekLast();
                return newest == null || newest < windowStart ? null : dq;
            });
        }
    }

    /**
     * @return number of keys currently tracked
     */
    int trackedKeys() {
        return windows.size();
    }

    @Override
    public String getRuleName() {
        return rule.getName();
    }
}
