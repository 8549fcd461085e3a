package com.threatsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Describes a single detector stage loaded from configuration.
 *
 * <p>
 * Supported rule types:
 * </p>
 * <ul>
 * <li>{@code signature}: regular-expression signatures over the payload</li>
 * <li>{@code rate}: events per key within a sliding time window</li>
 * <li>{@code threshold}: static threshold on a numeric payload field</li>
 * <li>{@code statistical}: per-key moving-average outlier</li>
 * <li>{@code blacklist}: source IP listed in threat intelligence</li>
 * <li>{@code llm}: verdict from a language model; the expensive stage</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields for the declared rule type are present and valid.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionRule {

    /** Unique rule name used in logs and detections. */
    private String name;

    /** Rule type, normalised to lowercase. */
    private String type;

    /** Attack classification reported by detections of this rule. */
    private String attackType;

    /** Severity name reported by detections of this rule. */
    private String severity;

    /** Event types the rule applies to; empty means all. */
    private List<String> eventTypes = new ArrayList<>();

    // --- Signature fields ---
    private List<String> patterns = new ArrayList<>();

    // --- Rate / statistical fields ---
    /** Event attribute used as the grouping key (source_ip, user_id, ...). */
    private String keyField;

    /** Size of the sliding window in seconds. */
    private int windowSeconds;

    // --- Threshold / statistical fields ---
    /** Payload field whose numeric value is evaluated. */
    private String field;

    /** Threshold value; semantics depend on the rule type. */
    private double threshold;

    /** Number of recent values to keep for the moving average. */
    private int windowSize = 10;

    /** Number of standard deviations for outlier detection. */
    private double deviationFactor = 2.0;

    // --- Blacklist fields ---
    private List<String> values = new ArrayList<>();

    // --- Language model fields ---
    private String endpoint;
    private String model;
    private int timeoutSeconds = 10;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared rule type are present
     * and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Rule 'type' is required");
        }
        if (attackType == null || attackType.isBlank()) {
            errors.add("Rule '" + name + "' requires 'attackType'");
        }
        try {
            Severity.parse(severity);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + name + "': " + e.getMessage());
        }

        if (type != null) {
            switch (type) {
                case "signature" -> {
                    if (patterns.isEmpty()) {
                        errors.add("Signature rule '" + name + "' requires at least one pattern");
                    }
                    for (String p : patterns) {
                        try {
                            Pattern.compile(p);
                        } catch (PatternSyntaxException e) {
                            errors.add("Signature rule '" + name + "' has invalid pattern '" + p + "'");
                        }
                    }
                }
                case "rate" -> {
                    if (keyField == null || keyField.isBlank()) {
                        errors.add("Rate rule '" + name + "' requires 'keyField'");
                    }
                    if (windowSeconds <= 0) {
                        errors.add("Rate rule '" + name + "' requires 'windowSeconds' > 0");
                    }
                    if (threshold <= 0) {
                        errors.add("Rate rule '" + name + "' requires 'threshold' > 0");
                    }
                }
                case "threshold" -> {
                    if (field == null || field.isBlank()) {
                        errors.add("Threshold rule '" + name + "' requires 'field'");
                    }
                }
                case "statistical" -> {
                    if (field == null || field.isBlank()) {
                        errors.add("Statistical rule '" + name + "' requires 'field'");
                    }
                    if (windowSize < 2) {
                        errors.add("Statistical rule '" + name + "' requires 'windowSize' >= 2");
                    }
                    if (deviationFactor <= 0) {
                        errors.add("Statistical rule '" + name + "' requires 'deviationFactor' > 0");
                    }
                }
                case "blacklist" -> {
                    if (values.isEmpty()) {
                        errors.add("Blacklist rule '" + name + "' requires at least one value");
                    }
                }
                case "llm" -> {
                    if (endpoint == null || endpoint.isBlank()) {
                        errors.add("LLM rule '" + name + "' requires 'endpoint'");
                    }
                    if (model == null || model.isBlank()) {
                        errors.add("LLM rule '" + name + "' requires 'model'");
                    }
                    if (timeoutSeconds <= 0) {
                        errors.add("LLM rule '" + name + "' requires 'timeoutSeconds' > 0");
                    }
                }
                default -> errors.add("Unknown rule type: '" + type
                        + "'. Supported: signature, rate, threshold, statistical, blacklist, llm");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionRule: " + String.join("; ", errors));
        }
    }

    /**
     * @return {@code true} for the rule type that must run behind the circuit
     *         breaker
     */
    public boolean isExpensive() {
        return "llm".equals(type);
    }

    /**
     * @param eventType event type of an incoming event
     * @return {@code true} if the rule has no event-type filter or the filter
     *         contains {@code eventType}
     */
    public boolean appliesTo(String eventType) {
        return eventTypes.isEmpty() || (eventType != null && eventTypes.contains(eventType));
    }

    /**
     * @return parsed severity
     * @throws IllegalArgumentException if the severity is missing or unknown
     */
    public Severity severityLevel() {
        return Severity.parse(severity);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the rule type, normalised to lowercase.
     *
     * @param type rule type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public String getAttackType() {
        return attackType;
    }

    public void setAttackType(String attackType) {
        this.attackType = attackType;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public List<String> getEventTypes() {
        return Collections.unmodifiableList(eventTypes);
    }

    public void setEventTypes(List<String> eventTypes) {
        this.eventTypes = eventTypes != null ? new ArrayList<>(eventTypes) : new ArrayList<>();
    }

    public List<String> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    public void setPatterns(List<String> patterns) {
        this.patterns = patterns != null ? new ArrayList<>(patterns) : new ArrayList<>();
    }

    public String getKeyField() {
        return keyField;
    }

    public void setKeyField(String keyField) {
        this.keyField = keyField;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public double getDeviationFactor() {
        return deviationFactor;
    }

    public void setDeviationFactor(double deviationFactor) {
        this.deviationFactor = deviationFactor;
    }

    public List<String> getValues() {
        return Collections.unmodifiableList(values);
    }

    public void setValues(List<String> values) {
        this.values = values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionRule that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "DetectionRule{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", attackType='" + attackType + '\'' +
                ", severity='" + severity + '\'' +
                ", eventTypes=" + eventTypes +
                ", keyField='" + keyField + '\'' +
                ", field='" + field + '\'' +
                ", threshold=" + threshold +
                ", windowSeconds=" + windowSeconds +
                '}';
    }
}
