package com.threatsentinel.core.risk;

import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.RiskScore;
import com.threatsentinel.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Combines the detections of one event into a {@link RiskScore}.
 *
 * <p>
 * The primary detection is the first one with the highest severity weight.
 * The score is {@code min(1, max + 0.1 × sum of the other weights)}, so it
 * never decreases when the strongest detection gets stronger. The severity
 * follows the primary detection, unless the score reaches the upgrade
 * threshold, in which case it becomes {@link Severity#CRITICAL}.
 * </p>
 *
 * @since 1.0.0
 */
public class RiskScorer {

    /** Contribution of each non-primary detection's weight. */
    static final double SECONDARY_FACTOR = 0.1;

    private final double upgradeThreshold;

    /**
     * @param upgradeThreshold score at which the severity becomes CRITICAL
     * @throws IllegalArgumentException if not in {@code (0, 1]}
     */
    public RiskScorer(double upgradeThreshold) {
        if (!(upgradeThreshold > 0 && upgradeThreshold <= 1)) {
            throw new IllegalArgumentException("upgradeThreshold must be in (0, 1], got: " + upgradeThreshold);
        }
        this.upgradeThreshold = upgradeThreshold;
    }

    /**
     * @param detections detections of one event, in pipeline order
     * @return aggregate risk
     * @throws IllegalArgumentException if {@code detections} is empty
     */
    public RiskScore score(List<Detection> detections) {
        Objects.requireNonNull(detections, "detections must not be null");
        if (detections.isEmpty()) {
            throw new IllegalArgumentException("At least one detection is required");
        }

        Detection primary = primary(detections);
        double max = primary.getSeverity().weight();
        double others = 0;
        for (Detection d : detections) {
            others += d.getSeverity().weight();
        }
        others -= max;

        double score = Math.min(1.0, max + SECONDARY_FACTOR * others);
        Severity severity = primary.getSeverity();

        List<String> factors = new ArrayList<>();
        for (Detection d : detections) {
            factors.add(d.getAttackType() + " (" + d.getSeverity() + ")");
        }
        if (detections.size() > 1) {
            factors.add("multiple detections (" + detections.size() + ")");
        }
        if (score >= upgradeThreshold && severity != Severity.CRITICAL) {
            severity = Severity.CRITICAL;
            factors.add(String.format(Locale.ROOT, "escalated: combined score %.2f", score));
        }
        return new RiskScore(score, severity, factors);
    }

    /**
     * @param detections non-empty detections
     * @return the first detection with the maximum weight
     */
    public static Detection primary(List<Detection> detections) {
        Detection primary = detections.get(0);
        for (Detection d : detections) {
            if (d.getSeverity().weight() > primary.getSeverity().weight()) {
                primary = d;
            }
        }
        return primary;
    }
}
