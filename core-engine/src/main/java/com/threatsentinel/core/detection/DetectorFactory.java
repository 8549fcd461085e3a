package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.DetectionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Maps a rule's {@code type} to its {@link ThreatDetector}.
 *
 * <p>
 * Type strings are case-insensitive. {@code llm} yields the expensive stage;
 * callers decide where it runs, see
 * {@link com.threatsentinel.core.pipeline.DetectionPipeline#fromRules}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
    }

    /**
     * @param rule validated rule
     * @return the detector enforcing {@code rule}
     * @throws IllegalArgumentException if the rule type is unknown
     */
    public static ThreatDetector create(DetectionRule rule) {
        Objects.requireNonNull(rule, "DetectionRule must not be null");
        String type = Objects.requireNonNull(rule.getType(), "Rule type must not be null");
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "signature" -> new SignatureDetector(rule);
            case "rate" -> new RateSpikeDetector(rule);
            case "threshold" -> new ThresholdDetector(rule);
            case "statistical" -> new StatisticalOutlierDetector(rule);
            case "blacklist" -> new BlacklistDetector(rule);
            case "llm" -> new LanguageModelDetector(rule);
            default -> throw new IllegalArgumentException(
                    "Rule '" + rule.getName() + "' has unknown type '" + type
                            + "' (expected signature, rate, threshold, statistical, blacklist or llm)");
        };
    }

    /**
     * @param rules rules in evaluation order
     * @return one detector per rule, same order, unmodifiable
     */
    public static List<ThreatDetector> createAll(List<DetectionRule> rules) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        List<ThreatDetector> detectors = rules.stream()
                .map(DetectorFactory::create)
                .toList();
        LOG.info("Built {} detector stage(s): {}", detectors.size(),
                detectors.stream().map(ThreatDetector::getRuleName).toList());
        return detectors;
    }
}
