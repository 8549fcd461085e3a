package com.threatsentinel.core.ratelimit;

import com.threatsentinel.core.model.RiskScore;
import com.threatsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Blocks source IPs that produced a high-risk event.
 *
 * <p>
 * A high-risk event sets the IP's block expiry to {@code now + duration},
 * replacing any earlier expiry even if it was later. Expired entries are
 * never swept; they simply stop blocking.
 * </p>
 *
 * @since 1.0.0
 */
public class AdaptiveRateLimiter {

    private static final Logger LOG = LoggerFactory.getLogger(AdaptiveRateLimiter.class);

    private final Map<String, Instant> blockedUntil = new ConcurrentHashMap<>();
    private final Duration duration;
    private final double highRiskThreshold;
    private final Clock clock;

    /**
     * @param duration          how long a block lasts
     * @param highRiskThreshold score at or above which an event is high risk
     * @param clock             time source
     */
    public AdaptiveRateLimiter(Duration duration, double highRiskThreshold, Clock clock) {
        this.duration = Objects.requireNonNull(duration, "duration must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.highRiskThreshold = highRiskThreshold;
    }

    /**
     * @param risk aggregate risk of an event
     * @return {@code true} if the event should block its source
     */
    public boolean isHighRisk(RiskScore risk) {
        return risk.getSeverity() == Severity.CRITICAL || risk.getScore() >= highRiskThreshold;
    }

    /**
     * Block {@code ip} for the configured duration if {@code risk} is high.
     *
     * @param ip   source IP; without one there is nothing to block, but a
     *             high-risk event is still reported as such
     * @param risk aggregate risk of the event
     * @return {@code true} if the event is high risk and must be rejected
     */
    public boolean recordHighRisk(String ip, RiskScore risk) {
        Objects.requireNonNull(risk, "risk must not be null");
        if (!isHighRisk(risk)) {
            return false;
        }
        if (ip == null) {
            LOG.warn("High-risk event without a source IP, nothing to block (score={}, severity={})",
                    risk.getScore(), risk.getSeverity());
            return true;
        }
        Instant expiry = clock.instant().plus(duration);
        blockedUntil.put(ip, expiry);
        LOG.warn("Rate limiting {} until {} (score={}, severity={})", ip, expiry, risk.getScore(), risk.getSeverity());
        return true;
    }

    /**
     * @param ip source IP
     * @return {@code true} while a block for {@code ip} has not expired
     */
    public boolean shouldBlock(String ip) {
        if (ip == null) {
            return false;
        }
        Instant expiry = blockedUntil.get(ip);
        return expiry != null && clock.instant().isBefore(expiry);
    }

    /**
     * @return number of IPs currently blocked
     */
    public int activeBlockCount() {
        Instant now = clock.instant();
        int count = 0;
        for (Instant expiry : blockedUntil.values()) {
            if (now.isBefore(expiry)) {
                count++;
            }
        }
        return count;
    }

    public Duration getDuration() {
        return duration;
    }
}
