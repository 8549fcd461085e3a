package com.threatsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a single detector firing on an event.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code attackType} and {@code severity} are
 * required; omitting either throws a {@link NullPointerException} at build
 * time. Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class Detection {

    /** Classification of the attack, e.g. {@code SQL_INJECTION}. */
    private final String attackType;

    private final Severity severity;

    /** Human-readable description of what was detected. */
    private final String description;

    /** Values that support the finding (matched pattern, counts, ...). */
    private final Map<String, Object> evidence;

    /** Name of the detector stage that produced this detection. */
    private final String detectorName;

    private Detection(Builder builder) {
        this.attackType = Objects.requireNonNull(builder.attackType, "attackType must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.description = builder.description != null ? builder.description : "";
        this.evidence = builder.evidence != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.evidence))
                : Collections.emptyMap();
        this.detectorName = builder.detectorName;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Detection} instances.
     */
    public static class Builder {
        private String attackType;
        private Severity severity;
        private String description;
        private Map<String, Object> evidence;
        private String detectorName;

        public Builder attackType(String attackType) {
            this.attackType = attackType;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder evidence(Map<String, Object> evidence) {
            this.evidence = evidence != null ? new LinkedHashMap<>(evidence) : null;
            return this;
        }

        public Builder evidence(String key, Object value) {
            if (this.evidence == null) {
                this.evidence = new LinkedHashMap<>();
            }
            this.evidence.put(key, value);
            return this;
        }

        public Builder detectorName(String detectorName) {
            this.detectorName = detectorName;
            return this;
        }

        /**
         * @return a new {@link Detection}
         * @throws NullPointerException if {@code attackType} or {@code severity}
         *                              is {@code null}
         */
        public Detection build() {
            return new Detection(this);
        }
    }

    @JsonProperty("attack_type")
    public String getAttackType() {
        return attackType;
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("evidence")
    public Map<String, Object> getEvidence() {
        return evidence;
    }

    @JsonProperty("detector")
    public String getDetectorName() {
        return detectorName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Detection that))
            return false;
        return Objects.equals(attackType, that.attackType)
                && severity == that.severity
                && Objects.equals(description, that.description)
                && Objects.equals(detectorName, that.detectorName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attackType, severity, description, detectorName);
    }

    @Override
    public String toString() {
        return "Detection{" +
                "attackType='" + attackType + '\'' +
                ", severity=" + severity +
                ", detector='" + detectorName + '\'' +
                ", description='" + description + '\'' +
                '}';
    }
}
