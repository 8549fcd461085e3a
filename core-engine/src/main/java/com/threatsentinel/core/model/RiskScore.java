package com.threatsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate risk derived from one or more {@link Detection}s.
 *
 * @since 1.0.0
 */
public final class RiskScore {

    private final double score;
    private final Severity severity;
    private final List<String> factors;

    /**
     * @param score    normalised score in {@code [0, 1]}
     * @param severity resulting severity label
     * @param factors  contributing factors, in report order
     * @throws IllegalArgumentException if {@code score} is outside {@code [0, 1]}
     */
    public RiskScore(double score, Severity severity, List<String> factors) {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be in [0, 1], got: " + score);
        }
        this.score = score;
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.factors = List.copyOf(Objects.requireNonNull(factors, "factors must not be null"));
    }

    @JsonProperty("score")
    public double getScore() {
        return score;
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    @JsonProperty("factors")
    public List<String> getFactors() {
        return factors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RiskScore that))
            return false;
        return Double.compare(score, that.score) == 0
                && severity == that.severity
                && factors.equals(that.factors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, severity, factors);
    }

    @Override
    public String toString() {
        return "RiskScore{score=" + score + ", severity=" + severity + ", factors=" + factors + '}';
    }
}
