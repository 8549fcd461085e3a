package com.threatsentinel.core.monitor;

import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.HealthRecord;
import com.threatsentinel.core.model.MonitorConfig;
import com.threatsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * {@link MonitorBackend} issuing a plain HTTP GET.
 *
 * <p>
 * Findings derived from a check:
 * </p>
 * <ul>
 * <li>{@code WEBSITE_DOWN} (HIGH): no response at all</li>
 * <li>{@code WEBSITE_SERVER_ERROR} (HIGH): status 5xx</li>
 * <li>{@code WEBSITE_SLOW} (MEDIUM): slower than the configured threshold,
 * only when {@code alert_on_performance} is set</li>
 * <li>{@code WEBSITE_CONTENT_MISSING} (MEDIUM): an expected keyword is
 * absent</li>
 * </ul>
 * <p>
 * Missing security headers and 4xx statuses degrade the status and are
 * listed as errors without raising a finding.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpMonitorBackend implements MonitorBackend {

    private static final Logger LOG = LoggerFactory.getLogger(HttpMonitorBackend.class);

    static final List<String> SECURITY_HEADERS = List.of(
            "Strict-Transport-Security",
            "Content-Security-Policy",
            "X-Frame-Options",
            "X-Content-Type-Options",
            "Referrer-Policy");

    static final String MISSING = "MISSING";

    private final HttpClient client;
    private final Clock clock;

    public HttpMonitorBackend(Clock clock) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .build(), clock);
    }

    public HttpMonitorBackend(HttpClient client, Clock clock) {
        this.client = Objects.requireNonNull(client, "HttpClient must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public HealthRecord check(MonitorConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        HttpRequest request = HttpRequest.newBuilder(URI.create(config.getUrl()))
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .header("User-Agent", "ThreatSentinel-Monitor/1.0")
                .GET()
                .build();

        Instant checkedAt = clock.instant();
        long started = System.nanoTime();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            long elapsed = elapsedMs(started);
            LOG.warn("{} unreachable: {}", config.getUrl(), e.getMessage());
            return HealthRecord.builder()
                    .url(config.getUrl())
                    .status(HealthRecord.Status.DOWN)
                    .responseTimeMs(elapsed)
                    .checkedAt(checkedAt)
                    .errors(List.of("Connection failed: " + describe(e)))
                    .findings(List.of(finding("WEBSITE_DOWN", Severity.HIGH,
                            config.getUrl() + " is unreachable: " + describe(e), config.getUrl())))
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while checking " + config.getUrl(), e);
        }
        long elapsed = elapsedMs(started);
        return evaluate(config, response.statusCode(), response.headers(), response.body(), elapsed, checkedAt);
    }

    HealthRecord evaluate(MonitorConfig config, int statusCode, HttpHeaders headers, String body,
            long elapsedMs, Instant checkedAt) {
        String url = config.getUrl();
        List<String> errors = new ArrayList<>();
        List<Detection> findings = new ArrayList<>();
        HealthRecord.Status status = HealthRecord.Status.UP;

        if (statusCode >= 500) {
            status = HealthRecord.Status.DOWN;
            errors.add("Server error: HTTP " + statusCode);
            findings.add(finding("WEBSITE_SERVER_ERROR", Severity.HIGH,
                    url + " returned HTTP " + statusCode, url));
        } else if (statusCode >= 400) {
            status = HealthRecord.Status.DEGRADED;
            errors.add("Client error: HTTP " + statusCode);
        }

        if (elapsedMs > config.getSlowResponseThresholdMs()) {
            status = worse(status, HealthRecord.Status.DEGRADED);
            errors.add("Slow response: " + elapsedMs + " ms");
            if (config.isAlertOnPerformance()) {
                findings.add(finding("WEBSITE_SLOW", Severity.MEDIUM,
                        url + " answered in " + elapsedMs + " ms (threshold "
                                + config.getSlowResponseThresholdMs() + " ms)", url));
            }
        }

        String lowerBody = body == null ? "" : body.toLowerCase(Locale.ROOT);
        List<String> missingKeywords = new ArrayList<>();
        for (String keyword : config.getExpectedKeywords()) {
            if (!lowerBody.contains(keyword.toLowerCase(Locale.ROOT))) {
                missingKeywords.add(keyword);
            }
        }
        if (!missingKeywords.isEmpty()) {
            status = worse(status, HealthRecord.Status.DEGRADED);
            errors.add("Missing expected content: " + missingKeywords);
            findings.add(finding("WEBSITE_CONTENT_MISSING", Severity.MEDIUM,
                    url + " is missing expected content " + missingKeywords, url));
        }

        Map<String, String> securityHeaders = new LinkedHashMap<>();
        if (config.isCheckSecurityHeaders()) {
            List<String> missing = new ArrayList<>();
            for (String name : SECURITY_HEADERS) {
                String value = headers.firstValue(name).orElse(null);
                securityHeaders.put(name, value != null ? value : MISSING);
                if (value == null) {
                    missing.add(name);
                }
            }
            if (!missing.isEmpty()) {
                errors.add("Missing security headers: " + String.join(", ", missing));
            }
        }

        return HealthRecord.builder()
                .url(url)
                .status(status)
                .statusCode(statusCode)
                .responseTimeMs(elapsedMs)
                .checkedAt(checkedAt)
                .errors(errors)
                .securityHeaders(securityHeaders)
                .findings(findings)
                .build();
    }

    private static HealthRecord.Status worse(HealthRecord.Status a, HealthRecord.Status b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    private static Detection finding(String type, Severity severity, String description, String url) {
        return Detection.builder()
                .attackType(type)
                .severity(severity)
                .description(description)
                .detectorName("website_monitor")
                .evidence("url", url)
                .build();
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}
