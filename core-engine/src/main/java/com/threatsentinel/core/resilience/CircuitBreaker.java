package com.threatsentinel.core.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Circuit breaker guarding one unreliable call, typically the expensive
 * detector stage. Backed by a Resilience4j state machine.
 *
 * <h3>States</h3>
 * <ul>
 * <li><b>Closed</b>: calls go through. Failures are counted in a time-based
 * window of {@code failureWindow}; when {@code failureThreshold} of them fall
 * inside it, the breaker opens.</li>
 * <li><b>Open</b>: calls are skipped until {@code cooldown} has elapsed since
 * the breaker opened (or since the last failed probe). After that one caller
 * at a time is admitted as a half-open probe. A successful probe closes the
 * breaker; a failed probe opens it again for a fresh cool-down.</li>
 * </ul>
 *
 * <p>
 * Every successful call clears the failure history, so the window only ever
 * holds failures and a 100% failure rate over {@code failureThreshold} calls
 * is the opening condition. A skipped or failed call yields
 * {@link Optional#empty()} and never propagates the failure.
 * </p>
 *
 * @since 1.0.0
 */
public class CircuitBreaker {

    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final Clock clock;
    private final io.github.resilience4j.circuitbreaker.CircuitBreaker delegate;

    // Guarded by "this".
    private Instant lastFailureTime;
    private String lastError;

    /**
     * @param name             name used in log messages
     * @param failureThreshold failures inside the window that open the breaker
     * @param failureWindow    trailing window for counting failures, whole
     *                         seconds
     * @param cooldown         time the breaker stays open before a probe
     * @param clock            time source
     * @throws IllegalArgumentException if the threshold or a duration is not
     *                                  positive
     */
    public CircuitBreaker(String name, int failureThreshold, Duration failureWindow,
            Duration cooldown, Clock clock) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(failureWindow, "failureWindow must not be null");
        Objects.requireNonNull(cooldown, "cooldown must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
        }
        if (failureWindow.isNegative() || failureWindow.isZero() || cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("failureWindow and cooldown must be positive");
        }

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.TIME_BASED)
                .slidingWindowSize((int) Math.max(1, failureWindow.toSeconds()))
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(cooldown)
                .build();
        this.delegate = new CircuitBreakerStateMachine(name, config, clock);
        this.delegate.getEventPublisher().onStateTransition(event -> LOG.warn(
                "Breaker [{}] state transition: {} -> {}", name,
                event.getStateTransition().getFromState(),
                event.getStateTransition().getToState()));
    }

    /**
     * Run {@code call} unless the breaker is open.
     *
     * @param call the guarded call
     * @param <T>  result type
     * @return the call's result; empty when skipped or when the call failed
     */
    public <T> Optional<T> execute(Supplier<Optional<T>> call) {
        Objects.requireNonNull(call, "call must not be null");
        if (!delegate.tryAcquirePermission()) {
            LOG.trace("Breaker [{}] open, skipping call", name);
            return Optional.empty();
        }

        long start = System.nanoTime();
        Optional<T> result;
        try {
            result = Objects.requireNonNullElse(call.get(), Optional.empty());
        } catch (RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            LOG.warn("Breaker [{}] guarded call failed: {}", name, error);
            recordFailure(error);
            delegate.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
            return Optional.empty();
        }
        delegate.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        if (delegate.getState() == io.github.resilience4j.circuitbreaker.CircuitBreaker.State.CLOSED
                && delegate.getMetrics().getNumberOfFailedCalls() > 0) {
            delegate.reset();
        }
        return result;
    }

    private synchronized void recordFailure(String error) {
        lastFailureTime = clock.instant();
        lastError = error;
    }

    /**
     * @return immutable snapshot; the failure count only covers the trailing
     *         window. A half-open breaker reports as open.
     */
    public synchronized CircuitBreakerState state() {
        boolean open = switch (delegate.getState()) {
            case OPEN, HALF_OPEN, FORCED_OPEN -> true;
            default -> false;
        };
        return new CircuitBreakerState(open, delegate.getMetrics().getNumberOfFailedCalls(),
                lastFailureTime, lastError);
    }

    /**
     * @return display status derived from {@link #state()}
     */
    public BreakerStatus status() {
        return BreakerStatus.of(state());
    }

    public String getName() {
        return name;
    }
}
