package com.threatsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Configuration of one monitored website.
 *
 * <p>
 * Deserialized from the monitor registration request. Call
 * {@link #normalized(int)} before use: it fills in a missing URL scheme,
 * rejects malformed URLs and clamps the check interval.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MonitorConfig {

    private static final Pattern IPV4_WITH_PORT = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}(:\\d+)?$");

    @JsonProperty("url")
    private String url;

    /** Seconds between two checks. */
    @JsonProperty("check_interval")
    @JsonAlias("checkInterval")
    private int checkIntervalSeconds = 300;

    /** Request timeout for a single check. */
    @JsonProperty("timeout")
    private int timeoutSeconds = 10;

    /** Keywords that must be present in the response body. */
    @JsonProperty("expected_keywords")
    private List<String> expectedKeywords = new ArrayList<>();

    @JsonProperty("check_security_headers")
    private boolean checkSecurityHeaders = true;

    @JsonProperty("alert_on_performance")
    private boolean alertOnPerformance = false;

    @JsonProperty("slow_response_threshold_ms")
    private long slowResponseThresholdMs = 3_000;

    public MonitorConfig() {
    }

    public MonitorConfig(String url) {
        this.url = url;
    }

    /**
     * Return a validated copy with a normalised URL and a clamped interval.
     *
     * <p>
     * A URL without a scheme gets {@code http://} when it points at a local
     * or literal IPv4 address (unless the port is 443) and {@code https://}
     * otherwise.
     * </p>
     *
     * @param minIntervalSeconds lower bound for the check interval
     * @return normalised configuration
     * @throws IllegalArgumentException if the URL is missing or malformed, or
     *                                  the timeout is not positive
     */
    public MonitorConfig normalized(int minIntervalSeconds) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Monitor 'url' is required");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("Monitor 'timeout' must be > 0, got: " + timeoutSeconds);
        }
        String candidate = withScheme(url.trim());
        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL format: '" + url + "'", e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("Invalid URL format: '" + url + "' (scheme must be http or https)");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new IllegalArgumentException("Invalid URL format: '" + url + "' (missing host)");
        }

        MonitorConfig copy = copy();
        copy.url = candidate;
        copy.checkIntervalSeconds = Math.max(minIntervalSeconds, checkIntervalSeconds);
        return copy;
    }

    private static String withScheme(String raw) {
        if (raw.contains("://")) {
            return raw;
        }
        int slash = raw.indexOf('/');
        String authority = slash >= 0 ? raw.substring(0, slash) : raw;
        boolean local = authority.startsWith("localhost")
                || authority.startsWith("127.0.0.1")
                || authority.startsWith("[::1]")
                || IPV4_WITH_PORT.matcher(authority).matches();
        if (local && !authority.endsWith(":443")) {
            return "http://" + raw;
        }
        return "https://" + raw;
    }

    private MonitorConfig copy() {
        MonitorConfig c = new MonitorConfig(url);
        c.checkIntervalSeconds = checkIntervalSeconds;
        c.timeoutSeconds = timeoutSeconds;
        c.expectedKeywords = new ArrayList<>(expectedKeywords);
        c.checkSecurityHeaders = checkSecurityHeaders;
        c.alertOnPerformance = alertOnPerformance;
        c.slowResponseThresholdMs = slowResponseThresholdMs;
        return c;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public int getCheckIntervalSeconds() {
        return checkIntervalSeconds;
    }

    public void setCheckIntervalSeconds(int checkIntervalSeconds) {
        this.checkIntervalSeconds = checkIntervalSeconds;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public List<String> getExpectedKeywords() {
        return Collections.unmodifiableList(expectedKeywords);
    }

    public void setExpectedKeywords(List<String> expectedKeywords) {
        this.expectedKeywords = expectedKeywords != null ? new ArrayList<>(expectedKeywords) : new ArrayList<>();
    }

    public boolean isCheckSecurityHeaders() {
        return checkSecurityHeaders;
    }

    public void setCheckSecurityHeaders(boolean checkSecurityHeaders) {
        this.checkSecurityHeaders = checkSecurityHeaders;
    }

    public boolean isAlertOnPerformance() {
        return alertOnPerformance;
    }

    public void setAlertOnPerformance(boolean alertOnPerformance) {
        this.alertOnPerformance = alertOnPerformance;
    }

    public long getSlowResponseThresholdMs() {
        return slowResponseThresholdMs;
    }

    public void setSlowResponseThresholdMs(long slowResponseThresholdMs) {
        this.slowResponseThresholdMs = slowResponseThresholdMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MonitorConfig that))
            return false;
        return checkIntervalSeconds == that.checkIntervalSeconds && Objects.equals(url, that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, checkIntervalSeconds);
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "url='" + url + '\'' +
                ", checkIntervalSeconds=" + checkIntervalSeconds +
                ", timeoutSeconds=" + timeoutSeconds +
                ", expectedKeywords=" + expectedKeywords +
                '}';
    }
}
