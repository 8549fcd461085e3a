package com.threatsentinel.core.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.threatsentinel.core.resilience.BreakerStatus;

import java.time.Instant;

/**
 * Point-in-time view of the engine's load, sent to observers as
 * {@code metrics_update}.
 *
 * @since 1.0.0
 */
public final class MetricsSnapshot {

    private final int requestsPerWindow;
    private final int errorsPerWindow;
    private final int activeObserverCount;
    private final BreakerStatus breakerStatus;
    private final int rateLimitedIpCount;
    private final Instant timestamp;

    public MetricsSnapshot(int requestsPerWindow, int errorsPerWindow, int activeObserverCount,
            BreakerStatus breakerStatus, int rateLimitedIpCount, Instant timestamp) {
        this.requestsPerWindow = requestsPerWindow;
        this.errorsPerWindow = errorsPerWindow;
        this.activeObserverCount = activeObserverCount;
        this.breakerStatus = breakerStatus;
        this.rateLimitedIpCount = rateLimitedIpCount;
        this.timestamp = timestamp;
    }

    @JsonProperty("requests_per_window")
    public int getRequestsPerWindow() {
        return requestsPerWindow;
    }

    @JsonProperty("errors_per_window")
    public int getErrorsPerWindow() {
        return errorsPerWindow;
    }

    @JsonProperty("active_connections")
    public int getActiveObserverCount() {
        return activeObserverCount;
    }

    @JsonProperty("llm_status")
    public BreakerStatus getBreakerStatus() {
        return breakerStatus;
    }

    @JsonProperty("rate_limited_ips")
    public int getRateLimitedIpCount() {
        return rateLimitedIpCount;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "MetricsSnapshot{requests=" + requestsPerWindow + ", errors=" + errorsPerWindow
                + ", observers=" + activeObserverCount + ", breaker=" + breakerStatus
                + ", rateLimited=" + rateLimitedIpCount + ", timestamp=" + timestamp + '}';
    }
}
