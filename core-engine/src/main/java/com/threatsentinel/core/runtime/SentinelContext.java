package com.threatsentinel.core.runtime;

import com.threatsentinel.core.broadcast.BroadcastHub;
import com.threatsentinel.core.config.SentinelSettings;
import com.threatsentinel.core.metrics.SlidingWindowCounter;
import com.threatsentinel.core.model.IncidentReport;
import com.threatsentinel.core.ratelimit.AdaptiveRateLimiter;
import com.threatsentinel.core.resilience.CircuitBreaker;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Process-wide state shared by the engine components.
 *
 * <p>
 * Created once at start-up and handed to every component constructor; there
 * are no static singletons. Each member guards its own state, so the context
 * itself needs no locking. {@link #close()} stops the task supervisor.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelContext implements AutoCloseable {

    /** How long shutdown waits for in-flight background tasks. */
    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final SentinelSettings settings;
    private final Clock clock;
    private final TaskSupervisor supervisor;
    private final AdaptiveRateLimiter rateLimiter;
    private final CircuitBreaker breaker;
    private final SlidingWindowCounter requests;
    private final SlidingWindowCounter errorEvents;
    private final BroadcastHub hub;
    private final BoundedHistory<IncidentReport> attackHistory;
    private final BoundedHistory<IncidentReport> websiteIncidents;

    /**
     * @param settings runtime settings
     * @param clock    time source for every time-based component
     */
    public SentinelContext(SentinelSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.supervisor = new TaskSupervisor(SHUTDOWN_TIMEOUT);
        this.rateLimiter = new AdaptiveRateLimiter(
                settings.getRateLimitDuration(), settings.getHighRiskThreshold(), clock);
        this.breaker = new CircuitBreaker("llm", settings.getBreakerFailureThreshold(),
                settings.getBreakerFailureWindow(), settings.getBreakerCooldown(), clock);
        this.requests = new SlidingWindowCounter(settings.getMetricsMaxEntries());
        this.errorEvents = new SlidingWindowCounter(settings.getMetricsMaxEntries());
        this.hub = new BroadcastHub();
        this.attackHistory = new BoundedHistory<>(settings.getAttackHistorySize());
        this.websiteIncidents = new BoundedHistory<>(settings.getWebsiteIncidentHistorySize());
    }

    public SentinelSettings getSettings() {
        return settings;
    }

    public Clock getClock() {
        return clock;
    }

    public TaskSupervisor getSupervisor() {
        return supervisor;
    }

    public AdaptiveRateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public CircuitBreaker getBreaker() {
        return breaker;
    }

    /**
     * @return timestamps of submitted events
     */
    public SlidingWindowCounter getRequests() {
        return requests;
    }

    /**
     * @return timestamps of events that produced at least one detection
     */
    public SlidingWindowCounter getErrorEvents() {
        return errorEvents;
    }

    public BroadcastHub getHub() {
        return hub;
    }

    /**
     * @return incidents raised from submitted events
     */
    public BoundedHistory<IncidentReport> getAttackHistory() {
        return attackHistory;
    }

    /**
     * @return incidents raised by endpoint monitors
     */
    public BoundedHistory<IncidentReport> getWebsiteIncidents() {
        return websiteIncidents;
    }

    @Override
    public void close() {
        supervisor.close();
    }
}
