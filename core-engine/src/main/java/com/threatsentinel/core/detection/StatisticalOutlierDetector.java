package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.DetectionRule;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Statistical outlier detector based on a moving average.
 *
 * <p>
 * Maintains a sliding window of the last <i>N</i> values of a numeric payload
 * field. A new value is considered an outlier when it deviates from the
 * moving average by more than {@code deviationFactor × σ}.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * One window is kept per key. The key is resolved from {@code keyField} when
 * the rule sets one and from {@code user_id} otherwise, so each customer is
 * compared with their own history. Events without a key share one global
 * window. Each window is guarded by its own monitor.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * Outlier detection only engages after at least {@value #MIN_HISTORY_SIZE}
 * observations have been recorded for the key.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalOutlierDetector implements ThreatDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalOutlierDetector.class);

    /** Minimum number of observations required before outlier checks begin. */
    static final int MIN_HISTORY_SIZE = 2;

    static final String DEFAULT_KEY_FIELD = "user_id";

    private static final String GLOBAL_KEY = "*";

    private final DetectionRule rule;
    private final Severity severity;
    private final String field;
    private final String keyField;
    private final int windowSize;
    private final double deviationFactor;

    private final Map<String, Deque<Double>> windows = new ConcurrentHashMap<>();

    /**
     * @param rule the detection rule configuration
     * @throws NullPointerException     if {@code rule} or required fields are
     *                                  {@code null}
     * @throws IllegalArgumentException if {@code windowSize} is invalid
     */
    public StatisticalOutlierDetector(DetectionRule rule) {
        this.rule = Objects.requireNonNull(rule, "DetectionRule must not be null");
        String ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.field = Objects.requireNonNull(rule.getField(),
                "Field must not be null for statistical rule '" + ruleName + "'");
        this.severity = rule.severityLevel();
        this.keyField = rule.getKeyField() != null && !rule.getKeyField().isBlank()
                ? rule.getKeyField()
                : DEFAULT_KEY_FIELD;
        this.windowSize = rule.getWindowSize() > 0 ? rule.getWindowSize() : 10;
        this.deviationFactor = rule.getDeviationFactor() > 0 ? rule.getDeviationFactor() : 2.0;

        if (windowSize < MIN_HISTORY_SIZE) {
            throw new IllegalArgumentException(
                    "windowSize must be >= " + MIN_HISTORY_SIZE + " for rule '" + ruleName
                            + "', got: " + windowSize);
        }
    }

    @Override
    public Optional<Detection> evaluate(SecurityEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        if (!rule.appliesTo(event.getEventType())) {
            return Optional.empty();
        }

        Optional<Double> optValue = event.getNumericField(field);
        if (optValue.isEmpty()) {
            LOG.trace("Rule [{}]: field '{}' not present or not numeric, skipping", rule.getName(), field);
            return Optional.empty();
        }

        double value = optValue.get();
        String key = event.resolve(keyField).orElse(GLOBAL_KEY);
        Deque<Double> window = windows.computeIfAbsent(key, k -> new ArrayDeque<>());

        synchronized (window) {
            Optional<Detection> result = Optional.empty();

            if (window.size() >= MIN_HISTORY_SIZE) {
                double mean = computeMean(window);
                double stddev = computeStdDev(window, mean);

                // Identical history: any different value is an outlier.
                double allowedDeviation = stddev == 0 ? 0 : deviationFactor * stddev;
                double diff = Math.abs(value - mean);

                if (diff > allowedDeviation) {
                    LOG.debug("Rule [{}] fired: {}={} value={} mean={} stddev={}",
                            rule.getName(), keyField, key, value, mean, stddev);
                    result = Optional.of(Detection.builder()
                            .attackType(rule.getAttackType())
                            .severity(severity)
                            .detectorName(rule.getName())
                            .description(String.format(
                                    "Statistical outlier: %s=%.2f (mean=%.2f, stddev=%.2f, factor=%.1f)",
                                    field, value, mean, stddev, deviationFactor))
                            .evidence("key", key)
                            .evidence("value", value)
                            .evidence("mean", mean)
                            .evidence("stddev", stddev)
                            .build());
                }
            }

            // The current value must not influence its own evaluation.
            window.addLast(value);
            if (window.size() > windowSize) {
                window.pollFirst();
            }
            return result;
        }
    }

    @Override
    public String getRuleName() {
        return rule.getName();
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    private static double computeMean(Deque<Double> window) {
        double sum = 0;
        for (double v : window) {
            sum += v;
        }
        return sum / window.size();
    }

    private static double computeStdDev(Deque<Double> window, double mean) {
        double sumSquaredDiff = 0;
        for (double v : window) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / window.size());
    }
}
