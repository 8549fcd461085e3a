package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.DetectionRule;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Threshold detector.
 *
 * <p>
 * Fires when a numeric payload field exceeds the configured threshold, for
 * example a payment amount far above anything a normal customer sends. This
 * is a <strong>stateless</strong> detector: each event is evaluated
 * independently.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdDetector implements ThreatDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdDetector.class);

    private final DetectionRule rule;
    private final Severity severity;
    private final String field;
    private final double threshold;

    /**
     * @param rule the detection rule configuration
     * @throws NullPointerException if {@code rule} or required fields are
     *                              {@code null}
     */
    public ThresholdDetector(DetectionRule rule) {
        this.rule = Objects.requireNonNull(rule, "DetectionRule must not be null");
        String ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.field = Objects.requireNonNull(rule.getField(),
                "Field must not be null for threshold rule '" + ruleName + "'");
        this.severity = rule.severityLevel();
        this.threshold = rule.getThreshold();
    }

    @Override
    public Optional<Detection> evaluate(SecurityEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        if (!rule.appliesTo(event.getEventType())) {
            return Optional.empty();
        }

        Optional<Double> value = event.getNumericField(field);
        if (value.isEmpty()) {
            LOG.trace("Rule [{}]: field '{}' not present or not numeric, skipping", rule.getName(), field);
            return Optional.empty();
        }

        double v = value.get();
        if (v > threshold) {
            LOG.debug("Rule [{}] fired: {}={} > threshold={}", rule.getName(), field, v, threshold);
            return Optional.of(Detection.builder()
                    .attackType(rule.getAttackType())
                    .severity(severity)
                    .detectorName(rule.getName())
                    .description(String.format(
                            "Threshold exceeded: %s=%.2f (threshold: %.2f)", field, v, threshold))
                    .evidence("field", field)
                    .evidence("value", v)
                    .evidence("threshold", threshold)
                    .build());
        }
        return Optional.empty();
    }

    @Override
    public String getRuleName() {
        return rule.getName();
    }
}
