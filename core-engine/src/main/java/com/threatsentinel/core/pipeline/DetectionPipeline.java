package com.threatsentinel.core.pipeline;

import com.threatsentinel.core.config.RulesConfig;
import com.threatsentinel.core.detection.DetectorFactory;
import com.threatsentinel.core.detection.ThreatDetector;
import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.DetectionRule;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.resilience.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs an event through the detector stages.
 *
 * <ol>
 * <li>Cheap stages run in configuration order. A CRITICAL detection stops
 * the scan immediately.</li>
 * <li>If no CRITICAL detection was found, the expensive stage (if any) runs
 * through the {@link CircuitBreaker}. While the breaker is open the stage is
 * skipped.</li>
 * <li>A stage that throws is logged and counts as "no detection"; the
 * remaining stages still run.</li>
 * </ol>
 *
 * <p>
 * The pipeline itself is stateless; stage state lives in the detectors.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionPipeline.class);

    private final List<ThreatDetector> stages;
    private final ThreatDetector expensiveStage;
    private final CircuitBreaker breaker;

    /**
     * @param stages         cheap stages, in evaluation order
     * @param expensiveStage stage guarded by the breaker, or {@code null}
     * @param breaker        breaker guarding {@code expensiveStage}
     */
    public DetectionPipeline(List<ThreatDetector> stages, ThreatDetector expensiveStage, CircuitBreaker breaker) {
        this.stages = List.copyOf(Objects.requireNonNull(stages, "stages must not be null"));
        this.expensiveStage = expensiveStage;
        this.breaker = Objects.requireNonNull(breaker, "breaker must not be null");
    }

    /**
     * Build a pipeline from configuration: every expensive rule goes behind
     * the breaker, the rest keep their listed order.
     *
     * @param config  validated rules
     * @param breaker breaker for the expensive stage
     * @return the pipeline
     */
    public static DetectionPipeline fromRules(RulesConfig config, CircuitBreaker breaker) {
        Objects.requireNonNull(config, "RulesConfig must not be null");
        List<DetectionRule> cheap = new ArrayList<>();
        DetectionRule expensive = null;
        for (DetectionRule rule : config.getRules()) {
            if (rule.isExpensive()) {
                expensive = rule;
            } else {
                cheap.add(rule);
            }
        }
        ThreatDetector expensiveStage = expensive != null ? DetectorFactory.create(expensive) : null;
        return new DetectionPipeline(DetectorFactory.createAll(cheap), expensiveStage, breaker);
    }

    /**
     * @param event the event to classify
     * @return detections in stage order; empty means no threat
     */
    public List<Detection> evaluate(SecurityEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        List<Detection> detections = new ArrayList<>();

        for (ThreatDetector stage : stages) {
            Optional<Detection> hit = runStage(stage, event);
            if (hit.isPresent()) {
                detections.add(hit.get());
                if (hit.get().getSeverity() == Severity.CRITICAL) {
                    LOG.debug("CRITICAL from [{}], skipping remaining stages", stage.getRuleName());
                    return detections;
                }
            }
        }

        if (expensiveStage != null) {
            breaker.execute(() -> expensiveStage.evaluate(event)).ifPresent(detections::add);
        }
        return detections;
    }

    private static Optional<Detection> runStage(ThreatDetector stage, SecurityEvent event) {
        try {
            return stage.evaluate(event);
        } catch (RuntimeException e) {
            LOG.warn("Detector [{}] failed, treating as no detection: {}", stage.getRuleName(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * @return the cheap stages, in order
     */
    public List<ThreatDetector> getStages() {
        return stages;
    }

    /**
     * @return the guarded stage, if configured
     */
    public Optional<ThreatDetector> getExpensiveStage() {
        return Optional.ofNullable(expensiveStage);
    }
}
