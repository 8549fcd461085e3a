package com.threatsentinel.core.monitor;

import com.sun.net.httpserver.HttpServer;
import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.HealthRecord;
import com.threatsentinel.core.model.MonitorConfig;
import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for {@link HttpMonitorBackend}.
 */
class HttpMonitorBackendTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static final HttpHeaders ALL_SECURITY_HEADERS = HttpHeaders.of(Map.of(
            "Strict-Transport-Security", List.of("max-age=31536000"),
            "Content-Security-Policy", List.of("default-src 'self'"),
            "X-Frame-Options", List.of("DENY"),
            "X-Content-Type-Options", List.of("nosniff"),
            "Referrer-Policy", List.of("no-referrer")), (name, value) -> true);

    private static final HttpHeaders NO_HEADERS = HttpHeaders.of(Map.of(), (name, value) -> true);

    private HttpMonitorBackend backend;
    private MonitorConfig config;

    @BeforeEach
    void setUp() {
        backend = new HttpMonitorBackend(MutableClock.at("2024-05-01T12:00:00Z"));
        config = new MonitorConfig("https://shop.example.com").normalized(10);
    }

    @Test
    @DisplayName("A fast 200 with every security header is UP with no errors")
    void shouldReportHealthyTarget() {
        HealthRecord record = backend.evaluate(config, 200, ALL_SECURITY_HEADERS, "welcome", 120, NOW);

        assertThat(record.getStatus()).isEqualTo(HealthRecord.Status.UP);
        assertThat(record.getErrors()).isEmpty();
        assertThat(record.getFindings()).isEmpty();
        assertThat(record.getSecurityHeaders()).containsEntry("X-Frame-Options", "DENY");
    }

    @Test
    @DisplayName("A 5xx status marks the target DOWN with a HIGH finding")
    void shouldFlagServerError() {
        HealthRecord record = backend.evaluate(config, 503, ALL_SECURITY_HEADERS, "", 80, NOW);

        assertThat(record.getStatus()).isEqualTo(HealthRecord.Status.DOWN);
        assertThat(record.getFindings())
                .extracting(Detection::getAttackType, Detection::getSeverity)
                .containsExactly(tuple("WEBSITE_SERVER_ERROR", Severity.HIGH));
    }

    @Test
    @DisplayName("A 4xx status and missing headers degrade without raising findings")
    void shouldDegradeOnClientErrorAndMissingHeaders() {
        HealthRecord record = backend.evaluate(config, 404, NO_HEADERS, "", 80, NOW);

        assertThat(record.getStatus()).isEqualTo(HealthRecord.Status.DEGRADED);
        assertThat(record.getFindings()).isEmpty();
        assertThat(record.getErrors()).anyMatch(e -> e.contains("HTTP 404"))
                .anyMatch(e -> e.startsWith("Missing security headers"));
        assertThat(record.getSecurityHeaders()).containsEntry("Referrer-Policy", HttpMonitorBackend.MISSING);
    }

    @Test
    @DisplayName("A slow answer raises a finding only when performance alerts are enabled")
    void shouldFlagSlowResponseWhenEnabled() {
        config.setSlowResponseThresholdMs(500);
        HealthRecord quiet = backend.evaluate(config, 200, ALL_SECURITY_HEADERS, "", 900, NOW);
        assertThat(quiet.getStatus()).isEqualTo(HealthRecord.Status.DEGRADED);
        assertThat(quiet.getFindings()).isEmpty();

        config.setAlertOnPerformance(true);
        HealthRecord alerting = backend.evaluate(config, 200, ALL_SECURITY_HEADERS, "", 900, NOW);
        assertThat(alerting.getFindings()).extracting(Detection::getAttackType).containsExactly("WEBSITE_SLOW");
        assertThat(alerting.getFindings().get(0).getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("Missing expected keywords are matched case-insensitively")
    void shouldFlagMissingKeywords() {
        config.setExpectedKeywords(List.of("Checkout", "Basket"));

        HealthRecord record = backend.evaluate(config, 200, ALL_SECURITY_HEADERS, "<h1>checkout</h1>", 50, NOW);

        assertThat(record.getStatus()).isEqualTo(HealthRecord.Status.DEGRADED);
        assertThat(record.getFindings()).extracting(Detection::getAttackType)
                .containsExactly("WEBSITE_CONTENT_MISSING");
        assertThat(record.getFindings().get(0).getDescription()).contains("Basket").doesNotContain("Checkout");
    }

    @Test
    @DisplayName("Header checks can be switched off")
    void shouldSkipHeaderChecks() {
        config.setCheckSecurityHeaders(false);

        HealthRecord record = backend.evaluate(config, 200, NO_HEADERS, "", 50, NOW);

        assertThat(record.getStatus()).isEqualTo(HealthRecord.Status.UP);
        assertThat(record.getSecurityHeaders()).isEmpty();
    }

    @Test
    @DisplayName("Should check a live endpoint over HTTP")
    void shouldCheckLiveEndpoint() throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            byte[] body = "status: ok".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("X-Frame-Options", "SAMEORIGIN");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        try {
            MonitorConfig local = new MonitorConfig("127.0.0.1:" + server.getAddress().getPort()).normalized(10);

            HealthRecord record = backend.check(local);

            assertThat(record.getStatusCode()).isEqualTo(200);
            assertThat(record.getCheckedAt()).isEqualTo(NOW);
            assertThat(record.getSecurityHeaders()).containsEntry("X-Frame-Options", "SAMEORIGIN");
            assertThat(record.getFindings()).isEmpty();
        } finally {
            server.stop(0);
        }
    }

    @Test
    @DisplayName("An unreachable target is DOWN with a HIGH finding")
    void shouldReportUnreachableTarget() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        MonitorConfig unreachable = new MonitorConfig("http://127.0.0.1:" + port).normalized(10);

        HealthRecord record = backend.check(unreachable);

        assertThat(record.getStatus()).isEqualTo(HealthRecord.Status.DOWN);
        assertThat(record.getFindings()).extracting(Detection::getAttackType).containsExactly("WEBSITE_DOWN");
        assertThat(record.getErrors()).first().asString().startsWith("Connection failed");
    }
}
