package com.threatsentinel.core.resilience;

import com.threatsentinel.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CircuitBreaker}.
 */
class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;
    private final AtomicInteger calls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T12:00:00Z");
        breaker = new CircuitBreaker("llm", 3, Duration.ofSeconds(60), Duration.ofSeconds(30), clock);
    }

    @Test
    @DisplayName("Should pass results through while closed")
    void shouldPassThrough() {
        assertThat(breaker.execute(succeeding("ok"))).contains("ok");
        assertThat(breaker.status()).isEqualTo(BreakerStatus.ACTIVE);
    }

    @Test
    @DisplayName("A failure yields empty and degrades the status")
    void failureShouldDegrade() {
        assertThat(breaker.execute(failing())).isEmpty();

        CircuitBreakerState state = breaker.state();
        assertThat(state.isOpen()).isFalse();
        assertThat(state.getFailureCount()).isEqualTo(1);
        assertThat(state.getLastError()).isEqualTo("model down");
        assertThat(state.getLastFailureTime()).isEqualTo(clock.instant());
        assertThat(breaker.status()).isEqualTo(BreakerStatus.DEGRADED);
    }

    @Test
    @DisplayName("Should open at the threshold and skip calls while open")
    void shouldOpenAtThreshold() {
        for (int i = 0; i < 3; i++) {
            breaker.execute(failing());
        }
        assertThat(breaker.status()).isEqualTo(BreakerStatus.OPEN);

        int before = calls.get();
        clock.advance(Duration.ofSeconds(29));
        assertThat(breaker.execute(succeeding("skipped"))).isEmpty();
        assertThat(calls.get()).isEqualTo(before);
    }

    @Test
    @DisplayName("Failures outside the trailing window do not count")
    void shouldForgetOldFailures() {
        breaker.execute(failing());
        clock.advance(Duration.ofSeconds(40));
        breaker.execute(failing());
        clock.advance(Duration.ofSeconds(40));
        breaker.execute(failing());

        assertThat(breaker.state().isOpen()).isFalse();
        assertThat(breaker.state().getFailureCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("A successful call clears the failure history")
    void successShouldClearFailures() {
        breaker.execute(failing());
        breaker.execute(failing());
        breaker.execute(succeeding("ok"));
        breaker.execute(failing());

        assertThat(breaker.state().isOpen()).isFalse();
        assertThat(breaker.state().getFailureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A successful probe after the cool-down closes the breaker")
    void probeShouldClose() {
        openBreaker();
        clock.advance(Duration.ofSeconds(31));

        assertThat(breaker.execute(succeeding("recovered"))).contains("recovered");
        assertThat(breaker.status()).isEqualTo(BreakerStatus.ACTIVE);
    }

    @Test
    @DisplayName("A failed probe restarts the cool-down")
    void failedProbeShouldRestartCooldown() {
        openBreaker();
        clock.advance(Duration.ofSeconds(31));
        breaker.execute(failing());

        clock.advance(Duration.ofSeconds(15));
        int before = calls.get();
        assertThat(breaker.execute(succeeding("skipped"))).isEmpty();
        assertThat(calls.get()).isEqualTo(before);

        clock.advance(Duration.ofSeconds(16));
        assertThat(breaker.execute(succeeding("probe"))).contains("probe");
    }

    @Test
    @DisplayName("Only one half-open probe runs at a time")
    void shouldAdmitSingleProbe() throws Exception {
        openBreaker();
        clock.advance(Duration.ofSeconds(31));

        CountDownLatch probeStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread prober = new Thread(() -> breaker.execute(() -> {
            probeStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Optional.of("probe");
        }));
        prober.start();
        assertThat(probeStarted.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(breaker.status()).isEqualTo(BreakerStatus.OPEN);
        int before = calls.get();
        assertThat(breaker.execute(succeeding("concurrent"))).isEmpty();
        assertThat(calls.get()).isEqualTo(before);

        release.countDown();
        prober.join(5_000);
        assertThat(breaker.status()).isEqualTo(BreakerStatus.ACTIVE);
    }

    @Test
    @DisplayName("Stays open until the cool-down has fully elapsed")
    void shouldStayOpenAtCooldownBoundary() {
        openBreaker();
        clock.advance(Duration.ofSeconds(30));

        int before = calls.get();
        assertThat(breaker.execute(succeeding("early"))).isEmpty();
        assertThat(calls.get()).isEqualTo(before);

        clock.advance(Duration.ofMillis(1));
        assertThat(breaker.execute(succeeding("probe"))).contains("probe");
    }

    @Test
    @DisplayName("A call returning null counts as success without a result")
    void nullResultIsEmptySuccess() {
        breaker.execute(failing());

        assertThat(breaker.execute(() -> null)).isEmpty();
        assertThat(breaker.state().getFailureCount()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void openBreaker() {
        for (int i = 0; i < 3; i++) {
            breaker.execute(failing());
        }
        assertThat(breaker.state().isOpen()).isTrue();
    }

    private Supplier<Optional<String>> succeeding(String value) {
        return () -> {
            calls.incrementAndGet();
            return Optional.of(value);
        };
    }

    private Supplier<Optional<String>> failing() {
        return () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("model down");
        };
    }
}
