package com.threatsentinel.core.resilience;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable snapshot of a {@link CircuitBreaker}.
 *
 * @since 1.0.0
 */
public final class CircuitBreakerState {

    private final boolean open;
    private final int failureCount;
    private final Instant lastFailureTime;
    private final String lastError;

    public CircuitBreakerState(boolean open, int failureCount, Instant lastFailureTime, String lastError) {
        this.open = open;
        this.failureCount = failureCount;
        this.lastFailureTime = lastFailureTime;
        this.lastError = lastError;
    }

    @JsonProperty("is_open")
    public boolean isOpen() {
        return open;
    }

    @JsonProperty("failure_count")
    public int getFailureCount() {
        return failureCount;
    }

    /**
     * @return time of the most recent failure, or {@code null} if none
     */
    @JsonProperty("last_failure_time")
    public Instant getLastFailureTime() {
        return lastFailureTime;
    }

    /**
     * @return message of the most recent failure, or {@code null} if none
     */
    @JsonProperty("last_error")
    public String getLastError() {
        return lastError;
    }

    @Override
    public String toString() {
        return "CircuitBreakerState{open=" + open + ", failureCount=" + failureCount
                + ", lastFailureTime=" + lastFailureTime + ", lastError='" + lastError + "'}";
    }
}
