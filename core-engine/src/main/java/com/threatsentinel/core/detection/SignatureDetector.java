package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.DetectionRule;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Signature detector.
 *
 * <p>
 * Matches every string value of the event payload, including values nested in
 * maps and lists, against a list of regular expressions. The first match
 * fires. Patterns are compiled case-insensitively.
 * </p>
 *
 * <p>
 * This is a <strong>stateless</strong> detector.
 * </p>
 *
 * @since 1.0.0
 */
public class SignatureDetector implements ThreatDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SignatureDetector.class);

    /** Longest excerpt of the offending value copied into evidence. */
    static final int MAX_EXCERPT = 120;

    private final DetectionRule rule;
    private final Severity severity;
    private final List<Pattern> patterns;

    /**
     * @param rule the detection rule configuration
     * @throws NullPointerException     if {@code rule} is {@code null}
     * @throws IllegalArgumentException if the rule has no pattern
     */
    public SignatureDetector(DetectionRule rule) {
        this.rule = Objects.requireNonNull(rule, "DetectionRule must not be null");
        Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.severity = rule.severityLevel();
        if (rule.getPatterns().isEmpty()) {
            throw new IllegalArgumentException(
                    "At least one pattern is required for rule '" + rule.getName() + "'");
        }
        this.patterns = rule.getPatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    @Override
    public Optional<Detection> evaluate(SecurityEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        if (!rule.appliesTo(event.getEventType())) {
            return Optional.empty();
        }
        return scan("data", event.getPayload());
    }

    private Optional<Detection> scan(String path, Object value) {
        if (value instanceof String s) {
            return match(path, s);
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                Optional<Detection> hit = scan(path + "." + e.getKey(), e.getValue());
                if (hit.isPresent()) {
                    return hit;
                }
            }
        } else if (value instanceof Collection<?> items) {
            int i = 0;
            for (Object item : items) {
                Optional<Detection> hit = scan(path + "[" + i++ + "]", item);
                if (hit.isPresent()) {
                    return hit;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Detection> match(String path, String value) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(value);
            if (m.find()) {
                LOG.debug("Rule [{}] fired: {} matched /{}/", rule.getName(), path, pattern.pattern());
                return Optional.of(Detection.builder()
                        .attackType(rule.getAttackType())
                        .severity(severity)
                        .detectorName(rule.getName())
                        .description(String.format("Signature match in %s: '%s'", path, m.group()))
                        .evidence("field", path)
                        .evidence("pattern", pattern.pattern())
                        .evidence("excerpt", excerpt(value))
                        .build());
            }
        }
        return Optional.empty();
    }

    private static String excerpt(String value) {
        return value.length() <= MAX_EXCERPT ? value : value.substring(0, MAX_EXCERPT) + "...";
    }

    @Override
    public String getRuleName() {
        return rule.getName();
    }
}
