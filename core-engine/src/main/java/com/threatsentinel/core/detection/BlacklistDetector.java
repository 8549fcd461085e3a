package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.DetectionRule;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Threat-intelligence detector.
 *
 * <p>
 * Fires when the event's source IP is listed in the rule's {@code values}.
 * An entry ending in {@code *} matches every address with that prefix, e.g.
 * {@code 203.0.113.*}. This is a <strong>stateless</strong> detector.
 * </p>
 *
 * @since 1.0.0
 */
public class BlacklistDetector implements ThreatDetector {

    private static final Logger LOG = LoggerFactory.getLogger(BlacklistDetector.class);

    private final DetectionRule rule;
    private final Severity severity;
    private final Set<String> addresses = new HashSet<>();
    private final List<String> prefixes = new ArrayList<>();

    /**
     * @param rule the detection rule configuration
     * @throws NullPointerException     if {@code rule} is {@code null}
     * @throws IllegalArgumentException if the rule lists no address
     */
    public BlacklistDetector(DetectionRule rule) {
        this.rule = Objects.requireNonNull(rule, "DetectionRule must not be null");
        Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.severity = rule.severityLevel();
        if (rule.getValues().isEmpty()) {
            throw new IllegalArgumentException(
                    "At least one address is required for rule '" + rule.getName() + "'");
        }
        for (String value : rule.getValues()) {
            String v = value.trim();
            if (v.endsWith("*")) {
                prefixes.add(v.substring(0, v.length() - 1));
            } else {
                addresses.add(v);
            }
        }
    }

    @Override
    public Optional<Detection> evaluate(SecurityEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        String ip = event.getSourceIp();
        if (ip == null || !rule.appliesTo(event.getEventType()) || !listed(ip)) {
            return Optional.empty();
        }
        LOG.debug("Rule [{}] fired: source IP {} is blacklisted", rule.getName(), ip);
        return Optional.of(Detection.builder()
                .attackType(rule.getAttackType())
                .severity(severity)
                .detectorName(rule.getName())
                .description("Source IP " + ip + " is listed in threat intelligence")
                .evidence("ip", ip)
                .build());
    }

    private boolean listed(String ip) {
        if (addresses.contains(ip)) {
            return true;
        }
        for (String prefix : prefixes) {
            if (ip.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return number of configured entries (addresses and prefixes)
     */
    public int size() {
        return addresses.size() + prefixes.size();
    }

    @Override
    public String getRuleName() {
        return rule.getName();
    }
}
