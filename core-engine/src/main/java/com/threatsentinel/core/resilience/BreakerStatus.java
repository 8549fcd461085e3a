package com.threatsentinel.core.resilience;

/**
 * Display status of a {@link CircuitBreaker}.
 *
 * <p>
 * Only {@link #ACTIVE} and {@link #OPEN} correspond to breaker states;
 * {@link #DEGRADED} is reported while the breaker is closed but has recorded
 * failures inside the trailing window.
 * </p>
 */
public enum BreakerStatus {
    ACTIVE,
    DEGRADED,
    OPEN;

    /**
     * @param state breaker snapshot
     * @return the status shown for that snapshot
     */
    public static BreakerStatus of(CircuitBreakerState state) {
        if (state.isOpen()) {
            return OPEN;
        }
        return state.getFailureCount() > 0 ? DEGRADED : ACTIVE;
    }
}
