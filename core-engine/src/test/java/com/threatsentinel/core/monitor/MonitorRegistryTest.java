package com.threatsentinel.core.monitor;

import com.threatsentinel.core.config.SentinelSettings;
import com.threatsentinel.core.incident.IncidentResponder;
import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.GeoLocation;
import com.threatsentinel.core.model.HealthRecord;
import com.threatsentinel.core.model.MonitorConfig;
import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.risk.RiskScorer;
import com.threatsentinel.core.runtime.SentinelContext;
import com.threatsentinel.core.support.Await;
import com.threatsentinel.core.support.InMemoryIncidentLog;
import com.threatsentinel.core.support.MutableClock;
import com.threatsentinel.core.support.RecordingObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitorRegistry} with a scripted backend.
 */
class MonitorRegistryTest {

    private SentinelContext context;
    private ScriptedBackend backend;
    private RecordingObserver dashboard;
    private IncidentResponder responder;
    private MonitorRegistry registry;

    @BeforeEach
    void setUp() {
        SentinelSettings settings = new SentinelSettings.Builder()
                .monitorMinIntervalSeconds(1)
                .monitorHistorySize(5)
                .build();
        context = new SentinelContext(settings, MutableClock.at("2024-05-01T12:00:00Z"));
        backend = new ScriptedBackend();
        dashboard = new RecordingObserver("dash");
        context.getHub().register(dashboard);
        responder = new IncidentResponder(context, new RiskScorer(0.95),
                new InMemoryIncidentLog(), ip -> GeoLocation.UNKNOWN);
        registry = new MonitorRegistry(context, backend, responder);
    }

    @AfterEach
    void tearDown() {
        registry.close();
        context.close();
    }

    @Test
    @DisplayName("Should start one task per normalised URL")
    void shouldStartOncePerUrl() throws InterruptedException {
        MonitorStartResult first = registry.start(new MonitorConfig("shop.example.com"));
        MonitorStartResult second = registry.start(new MonitorConfig("https://shop.example.com"));

        assertThat(first.getOutcome()).isEqualTo(MonitorStartResult.Outcome.STARTED);
        assertThat(first.getUrl()).isEqualTo("https://shop.example.com");
        assertThat(second.getOutcome()).isEqualTo(MonitorStartResult.Outcome.ALREADY_MONITORING);
        assertThat(backend.firstCheck.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(registry.list()).hasSize(1);
        assertThat(registry.list().get(0).getUrl()).isEqualTo("https://shop.example.com");
        assertThat(registry.isMonitoring("shop.example.com")).isTrue();
    }

    @Test
    @DisplayName("Each check is kept in the history and broadcast as website_health")
    void shouldRecordAndBroadcastChecks() throws InterruptedException {
        registry.start(new MonitorConfig("https://shop.example.com"));
        assertThat(Await.until(() -> !dashboard.messagesOfType("website_health").isEmpty(),
                Duration.ofSeconds(5))).isTrue();

        List<HealthRecord> history = registry.history("https://shop.example.com");
        assertThat(history).isNotEmpty();
        assertThat(history.get(0).getStatus()).isEqualTo(HealthRecord.Status.UP);
        assertThat(dashboard.messagesOfType("website_health")).isNotEmpty();
        assertThat(context.getWebsiteIncidents().size()).isZero();
    }

    @Test
    @DisplayName("Only findings of severity HIGH or above become website incidents")
    void shouldRaiseIncidentsForHighFindings() throws InterruptedException {
        backend.findings = List.of(
                finding("WEBSITE_SERVER_ERROR", Severity.HIGH),
                finding("WEBSITE_SLOW", Severity.MEDIUM));

        registry.start(new MonitorConfig("https://shop.example.com"));
        assertThat(Await.until(() -> context.getWebsiteIncidents().size() > 0, Duration.ofSeconds(5))).isTrue();
        registry.stop("https://shop.example.com");

        assertThat(context.getWebsiteIncidents().snapshot())
                .isNotEmpty()
                .allMatch(r -> r.getAttackType().equals("WEBSITE_SERVER_ERROR"));
    }

    @Test
    @DisplayName("Stop ends the task and deregisters it; stopping again is not found")
    void shouldStopTask() throws InterruptedException {
        registry.start(new MonitorConfig("https://shop.example.com"));
        assertThat(backend.firstCheck.await(5, TimeUnit.SECONDS)).isTrue();

        registry.stop("shop.example.com");

        assertThat(registry.list()).isEmpty();
        assertThat(registry.isMonitoring("https://shop.example.com")).isFalse();
        int checks = backend.checks.get();
        Thread.sleep(1_500);
        assertThat(backend.checks).hasValue(checks);
        assertThatThrownBy(() -> registry.stop("https://shop.example.com"))
                .isInstanceOf(MonitorNotFoundException.class)
                .hasMessageContaining("shop.example.com");
    }

    @Test
    @DisplayName("A failing check is logged and retried on the next cycle")
    void shouldSurviveFailingChecks() throws InterruptedException {
        backend.failuresBeforeSuccess.set(1);

        registry.start(new MonitorConfig("https://shop.example.com"));

        assertThat(backend.firstSuccess.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(Await.until(() -> !registry.history("https://shop.example.com").isEmpty(),
                Duration.ofSeconds(5))).isTrue();
        assertThat(backend.checks.get()).isGreaterThanOrEqualTo(2);
    }

    @Test
    @DisplayName("Should reject an invalid configuration")
    void shouldRejectInvalidConfig() {
        MonitorConfig noTimeout = new MonitorConfig("https://shop.example.com");
        noTimeout.setTimeoutSeconds(0);

        assertThatThrownBy(() -> registry.start(new MonitorConfig("ftp://files.example.com")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.start(noTimeout))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.list()).isEmpty();
    }

    @Test
    @DisplayName("Stop all ends every task")
    void shouldStopAll() throws InterruptedException {
        registry.start(new MonitorConfig("https://a.example.com"));
        registry.start(new MonitorConfig("https://b.example.com"));
        assertThat(backend.firstCheck.await(5, TimeUnit.SECONDS)).isTrue();

        registry.stopAll();

        assertThat(registry.list()).isEmpty();
    }

    @Test
    @DisplayName("Stop waits for a check that ignores interrupts before the target can restart")
    void stopShouldWaitForUninterruptibleCheck() throws InterruptedException {
        UninterruptibleBackend slow = new UninterruptibleBackend(Duration.ofMillis(1_500));
        MonitorRegistry slowRegistry = new MonitorRegistry(context, slow, responder, Duration.ofMillis(200));
        try {
            slowRegistry.start(new MonitorConfig("https://slow.example.com"));
            assertThat(slow.entered.await(5, TimeUnit.SECONDS)).isTrue();

            slowRegistry.stop("https://slow.example.com");

            assertThat(slow.live).hasValue(0);
            assertThat(slow.interrupted).isTrue();
            assertThat(slowRegistry.isMonitoring("https://slow.example.com")).isFalse();
            assertThat(dashboard.messagesOfType("website_health")).isEmpty();

            MonitorStartResult restart = slowRegistry.start(new MonitorConfig("https://slow.example.com"));
            assertThat(restart.getOutcome()).isEqualTo(MonitorStartResult.Outcome.STARTED);
            assertThat(Await.until(() -> slow.checks.get() == 2, Duration.ofSeconds(5))).isTrue();
            assertThat(slow.maxLive).hasValue(1);
        } finally {
            slowRegistry.close();
        }
    }

    private static Detection finding(String type, Severity severity) {
        return Detection.builder()
                .attackType(type)
                .severity(severity)
                .detectorName("website_monitor")
                .build();
    }

    private static final class ScriptedBackend implements MonitorBackend {
        final CountDownLatch firstCheck = new CountDownLatch(1);
        final CountDownLatch firstSuccess = new CountDownLatch(1);
        final AtomicInteger checks = new AtomicInteger();
        final AtomicInteger failuresBeforeSuccess = new AtomicInteger();
        volatile List<Detection> findings = List.of();

        @Override
        public HealthRecord check(MonitorConfig config) {
            checks.incrementAndGet();
            firstCheck.countDown();
            if (failuresBeforeSuccess.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new IllegalStateException("DNS failure");
            }
            HealthRecord record = HealthRecord.builder()
                    .url(config.getUrl())
                    .status(findings.isEmpty() ? HealthRecord.Status.UP : HealthRecord.Status.DOWN)
                    .statusCode(findings.isEmpty() ? 200 : 503)
                    .checkedAt(Instant.parse("2024-05-01T12:00:00Z"))
                    .findings(findings)
                    .build();
            firstSuccess.countDown();
            return record;
        }
    }

    private static final class UninterruptibleBackend implements MonitorBackend {
        final CountDownLatch entered = new CountDownLatch(1);
        final AtomicInteger checks = new AtomicInteger();
        final AtomicInteger live = new AtomicInteger();
        final AtomicInteger maxLive = new AtomicInteger();
        final AtomicBoolean interrupted = new AtomicBoolean();
        private final Duration checkDuration;

        UninterruptibleBackend(Duration checkDuration) {
            this.checkDuration = checkDuration;
        }

        @Override
        public HealthRecord check(MonitorConfig config) {
            int running = live.incrementAndGet();
            maxLive.accumulateAndGet(running, Math::max);
            checks.incrementAndGet();
            entered.countDown();
            long deadline = System.nanoTime() + checkDuration.toNanos();
            try {
                while (System.nanoTime() < deadline) {
                    try {
                        Thread.sleep(20);
                    } catch (InterruptedException e) {
                        interrupted.set(true);
                    }
                }
                return HealthRecord.builder()
                        .url(config.getUrl())
                        .status(HealthRecord.Status.UP)
                        .statusCode(200)
                        .checkedAt(Instant.parse("2024-05-01T12:00:00Z"))
                        .findings(List.of())
                        .build();
            } finally {
                live.decrementAndGet();
            }
        }
    }
}
