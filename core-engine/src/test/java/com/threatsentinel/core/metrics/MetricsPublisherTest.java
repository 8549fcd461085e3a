package com.threatsentinel.core.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.threatsentinel.core.broadcast.Observer;
import com.threatsentinel.core.config.SentinelSettings;
import com.threatsentinel.core.resilience.BreakerStatus;
import com.threatsentinel.core.runtime.SentinelContext;
import com.threatsentinel.core.support.Await;
import com.threatsentinel.core.support.MutableClock;
import com.threatsentinel.core.support.RecordingObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Unit tests for {@link MetricsPublisher}.
 */
class MetricsPublisherTest {

    private MutableClock clock;
    private SentinelContext context;
    private MetricsPublisher publisher;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T12:00:00Z");
        SentinelSettings settings = new SentinelSettings.Builder()
                .metricsWindow(Duration.ofSeconds(60))
                .build();
        context = new SentinelContext(settings, clock);
        publisher = new MetricsPublisher(context);
    }

    @AfterEach
    void tearDown() {
        publisher.close();
        context.close();
    }

    @Test
    @DisplayName("Tick prunes entries outside the window and broadcasts the snapshot")
    void shouldPruneAndBroadcast() throws InterruptedException {
        RecordingObserver dashboard = new RecordingObserver("dash-1");
        context.getHub().register(dashboard);

        context.getRequests().record(clock.instant());
        context.getErrorEvents().record(clock.instant());
        clock.advance(Duration.ofSeconds(90));
        context.getRequests().record(clock.instant());

        MetricsSnapshot snapshot = publisher.tick();

        assertThat(snapshot.getRequestsPerWindow()).isEqualTo(1);
        assertThat(snapshot.getErrorsPerWindow()).isZero();
        assertThat(snapshot.getActiveObserverCount()).isEqualTo(1);
        assertThat(snapshot.getBreakerStatus()).isEqualTo(BreakerStatus.ACTIVE);
        assertThat(snapshot.getTimestamp()).isEqualTo(clock.instant());

        assertThat(Await.until(() -> !dashboard.messagesOfType("metrics_update").isEmpty(),
                Duration.ofSeconds(5))).isTrue();
        List<JsonNode> updates = dashboard.messagesOfType("metrics_update");
        assertThat(updates).hasSize(1);
        assertThat(updates.get(0).path("requests_per_window").asInt()).isEqualTo(1);
        assertThat(updates.get(0).path("llm_status").asText()).isEqualTo("ACTIVE");
        assertThat(updates.get(0).has("rate_limited_ips")).isTrue();
    }

    @Test
    @DisplayName("A stalled observer does not hold up the tick")
    void tickShouldNotWaitForDelivery() throws InterruptedException {
        CountDownLatch delivering = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        context.getHub().register(new Observer() {
            @Override
            public String id() {
                return "stalled";
            }

            @Override
            public void send(String message) {
                delivering.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });

        try {
            long start = System.nanoTime();
            publisher.tick();
            publisher.tick();
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(delivering.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(elapsedMillis).isLessThan(1_000);
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("Snapshot neither prunes nor broadcasts")
    void snapshotShouldBeReadOnly() {
        RecordingObserver dashboard = new RecordingObserver("dash-1");
        context.getHub().register(dashboard);
        context.getRequests().record(clock.instant());
        clock.advance(Duration.ofMinutes(10));

        assertThat(publisher.snapshot().getRequestsPerWindow()).isEqualTo(1);
        assertThat(dashboard.messages()).isEmpty();
    }

    @Test
    @DisplayName("Start is idempotent and close cancels the loop")
    void shouldStartOnce() {
        assertThatCode(() -> {
            publisher.start();
            publisher.start();
            publisher.close();
            publisher.close();
        }).doesNotThrowAnyException();
    }
}
