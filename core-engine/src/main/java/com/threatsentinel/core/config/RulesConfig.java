package com.threatsentinel.core.config;

import com.threatsentinel.core.model.DetectionRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the detection rules YAML.
 *
 * <p>
 * Rule order is pipeline order: the cheap stages run in the order they are
 * listed. Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - name: sql_injection
 *     type: signature
 *     attackType: SQL_INJECTION
 *     severity: HIGH
 *     patterns:
 *       - "(?i)union\\s+select"
 *   - name: card_testing
 *     type: rate
 *     attackType: CARD_TESTING
 *     severity: CRITICAL
 *     eventTypes: [payment_failure]
 *     keyField: source_ip
 *     windowSeconds: 300
 *     threshold: 2
 * </pre>
 *
 * @since 1.0.0
 */
public class RulesConfig {

    private List<DetectionRule> rules = new ArrayList<>();

    /**
     * Return the rules list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of detection rules
     */
    public List<DetectionRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     *
     * @param rules the detection rules
     */
    public void setRules(List<DetectionRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * Validate every rule, then the rule set as a whole: names must be unique
     * and at most one rule may be expensive.
     *
     * @throws IllegalStateException if one or more rules are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();
        int expensive = 0;

        for (int i = 0; i < rules.size(); i++) {
            DetectionRule rule = Objects.requireNonNull(rules.get(i),
                    "Rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
                continue;
            }
            if (!names.add(rule.getName())) {
                errors.add("Duplicate rule name: '" + rule.getName() + "'");
            }
            if (rule.isExpensive()) {
                expensive++;
            }
        }
        if (expensive > 1) {
            errors.add("At most one expensive (llm) rule is allowed, found " + expensive);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "RulesConfig{rules=" + rules + '}';
    }
}
