package com.threatsentinel.core.service;

import com.threatsentinel.core.config.RulesLoader;
import com.threatsentinel.core.config.SentinelSettings;
import com.threatsentinel.core.detection.ThreatDetector;
import com.threatsentinel.core.incident.IncidentResponder;
import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.GeoLocation;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.pipeline.DetectionPipeline;
import com.threatsentinel.core.resilience.BreakerStatus;
import com.threatsentinel.core.risk.RiskScorer;
import com.threatsentinel.core.runtime.SentinelContext;
import com.threatsentinel.core.support.InMemoryIncidentLog;
import com.threatsentinel.core.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ThreatSentinelService} running the bundled rules.
 */
class ThreatSentinelServiceTest {

    private MutableClock clock;
    private SentinelContext context;
    private InMemoryIncidentLog incidentLog;
    private ThreatSentinelService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T12:00:00Z");
        context = new SentinelContext(new SentinelSettings.Builder()
                .breakerFailureThreshold(2)
                .build(), clock);
        incidentLog = new InMemoryIncidentLog();
        service = serviceFor(DetectionPipeline.fromRules(RulesLoader.load(), context.getBreaker()));
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    private ThreatSentinelService serviceFor(DetectionPipeline pipeline) {
        IncidentResponder responder = new IncidentResponder(context, new RiskScorer(0.95), incidentLog,
                ip -> GeoLocation.UNKNOWN);
        return new ThreatSentinelService(context, pipeline, responder);
    }

    @Test
    @DisplayName("A benign event is accepted with no incident")
    void shouldAcceptBenignEvent() {
        SubmissionResult result = service.submitEvent(event("login", "198.18.0.50")
                .field("username", "alice")
                .build());

        assertThat(result.getStatus()).isEqualTo(SubmissionResult.Status.NO_THREAT);
        assertThat(result.httpStatus()).isEqualTo(200);
        assertThat(result.getReport()).isEmpty();
        assertThat(context.getRequests().size()).isEqualTo(1);
        assertThat(context.getErrorEvents().size()).isZero();
    }

    @Test
    @DisplayName("A SQL injection is reported with 200 and recorded as an incident")
    void shouldReportSqlInjection() {
        SubmissionResult result = service.submitEvent(event("login", "198.18.0.51")
                .field("username", "admin' OR 1=1--")
                .build());

        assertThat(result.getStatus()).isEqualTo(SubmissionResult.Status.THREAT_DETECTED);
        assertThat(result.httpStatus()).isEqualTo(200);
        assertThat(result.getReport()).hasValueSatisfying(r -> {
            assertThat(r.getAttackType()).isEqualTo("SQL_INJECTION");
            assertThat(r.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(r.getSourceIp()).isEqualTo("198.18.0.51");
        });
        assertThat(context.getErrorEvents().size()).isEqualTo(1);
        assertThat(context.getAttackHistory().size()).isEqualTo(1);
        assertThat(context.getSupervisor().awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(incidentLog.reports()).hasSize(1);
        assertThat(context.getRateLimiter().shouldBlock("198.18.0.51")).isFalse();
    }

    @Test
    @DisplayName("Card testing is rejected with 403 and the source then gets 429")
    void shouldBlockCardTesting() {
        String ip = "198.18.0.7";
        assertThat(service.submitEvent(failure(ip)).getStatus()).isEqualTo(SubmissionResult.Status.NO_THREAT);
        assertThat(service.submitEvent(failure(ip)).getStatus()).isEqualTo(SubmissionResult.Status.NO_THREAT);

        SubmissionResult blocked = service.submitEvent(failure(ip));
        assertThat(blocked.httpStatus()).isEqualTo(403);
        assertThat(blocked.getStatus()).isEqualTo(SubmissionResult.Status.REJECTED);
        assertThat(blocked.getReport()).hasValueSatisfying(r -> {
            assertThat(r.getAttackType()).isEqualTo("CARD_TESTING");
            assertThat(r.getSeverity()).isEqualTo(Severity.CRITICAL);
        });

        SubmissionResult limited = service.submitEvent(event("login", ip).build());
        assertThat(limited.httpStatus()).isEqualTo(429);
        assertThat(limited.getReport()).isEmpty();
        assertThat(context.getRequests().size()).isEqualTo(4);
        assertThat(context.getAttackHistory().size()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(6));
        assertThat(service.submitEvent(event("login", ip).build()).httpStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("A high-risk event without a source IP is rejected with 403")
    void shouldRejectHighRiskEventWithoutIp() {
        SubmissionResult result = service.submitEvent(SecurityEvent.builder()
                .eventType("comment")
                .field("body", "1 OR 1=1 <script>alert(1)</script>")
                .build());

        assertThat(result.httpStatus()).isEqualTo(403);
        assertThat(result.getStatus()).isEqualTo(SubmissionResult.Status.REJECTED);
        assertThat(result.getReport()).hasValueSatisfying(r ->
                assertThat(r.getRisk().getScore()).isGreaterThanOrEqualTo(0.8));
        assertThat(context.getRateLimiter().activeBlockCount()).isZero();
    }

    @Test
    @DisplayName("A blacklisted source is reported as known malicious")
    void shouldFlagBlacklistedSource() {
        SubmissionResult result = service.submitEvent(event("page_view", "203.0.113.77").build());

        assertThat(result.getReport()).hasValueSatisfying(r ->
                assertThat(r.getAttackType()).isEqualTo("KNOWN_MALICIOUS_IP"));
    }

    @Test
    @DisplayName("A failing expensive stage opens the breaker and events still get an answer")
    void shouldDegradeWhenExpensiveStageFails() {
        AtomicInteger calls = new AtomicInteger();
        ThreatDetector failingModel = new ThreatDetector() {
            @Override
            public Optional<Detection> evaluate(SecurityEvent event) {
                calls.incrementAndGet();
                throw new IllegalStateException("model endpoint unreachable");
            }

            @Override
            public String getRuleName() {
                return "llm_review";
            }
        };
        ThreatSentinelService guarded = serviceFor(
                new DetectionPipeline(List.of(), failingModel, context.getBreaker()));

        for (int i = 0; i < 4; i++) {
            SubmissionResult result = guarded.submitEvent(event("login", "198.18.0.60").build());
            assertThat(result.getStatus()).isEqualTo(SubmissionResult.Status.NO_THREAT);
        }

        assertThat(calls).hasValue(2);
        assertThat(context.getBreaker().status()).isEqualTo(BreakerStatus.OPEN);
    }

    @Test
    @DisplayName("Should reject an event without a type")
    void shouldRequireEventType() {
        assertThatThrownBy(() -> service.submitEvent(SecurityEvent.builder().sourceIp("198.18.0.1").build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("event_type");
        assertThat(context.getRequests().size()).isZero();
    }

    private static SecurityEvent.Builder event(String type, String ip) {
        return SecurityEvent.builder().eventType(type).sourceIp(ip);
    }

    private static SecurityEvent failure(String ip) {
        return event("payment_failure", ip).field("card_bin", "411111").build();
    }
}
