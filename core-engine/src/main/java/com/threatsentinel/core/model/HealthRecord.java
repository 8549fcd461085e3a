package com.threatsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one health check against a monitored website.
 *
 * @since 1.0.0
 */
public final class HealthRecord {

    /** Overall health of a target at check time. */
    public enum Status {
        UP,
        DEGRADED,
        DOWN
    }

    private final String url;
    private final Status status;
    private final long responseTimeMs;
    private final int statusCode;
    private final Instant checkedAt;
    private final List<String> errors;
    private final Map<String, String> securityHeaders;
    private final List<Detection> findings;

    private HealthRecord(Builder b) {
        this.url = Objects.requireNonNull(b.url, "url must not be null");
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        this.responseTimeMs = b.responseTimeMs;
        this.statusCode = b.statusCode;
        this.checkedAt = Objects.requireNonNull(b.checkedAt, "checkedAt must not be null");
        this.errors = List.copyOf(b.errors);
        this.securityHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(b.securityHeaders));
        this.findings = List.copyOf(b.findings);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link HealthRecord}.
     */
    public static class Builder {
        private String url;
        private Status status;
        private long responseTimeMs;
        private int statusCode;
        private Instant checkedAt;
        private List<String> errors = List.of();
        private Map<String, String> securityHeaders = Map.of();
        private List<Detection> findings = List.of();

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder status(Status status) {
            this.status = status;
            return this;
        }

        public Builder responseTimeMs(long responseTimeMs) {
            this.responseTimeMs = responseTimeMs;
            return this;
        }

        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder checkedAt(Instant checkedAt) {
            this.checkedAt = checkedAt;
            return this;
        }

        public Builder errors(List<String> errors) {
            this.errors = errors != null ? errors : List.of();
            return this;
        }

        public Builder securityHeaders(Map<String, String> securityHeaders) {
            this.securityHeaders = securityHeaders != null ? securityHeaders : Map.of();
            return this;
        }

        public Builder findings(List<Detection> findings) {
            this.findings = findings != null ? findings : List.of();
            return this;
        }

        public HealthRecord build() {
            return new HealthRecord(this);
        }
    }

    /**
     * @param threshold minimum severity
     * @return findings whose severity is at least {@code threshold}
     */
    public List<Detection> findingsAtLeast(Severity threshold) {
        return findings.stream()
                .filter(d -> d.getSeverity().isAtLeast(threshold))
                .toList();
    }

    @JsonProperty("url")
    public String getUrl() {
        return url;
    }

    @JsonProperty("status")
    public Status getStatus() {
        return status;
    }

    @JsonProperty("response_time_ms")
    public long getResponseTimeMs() {
        return responseTimeMs;
    }

    @JsonProperty("status_code")
    public int getStatusCode() {
        return statusCode;
    }

    @JsonProperty("last_check")
    public Instant getCheckedAt() {
        return checkedAt;
    }

    @JsonProperty("errors")
    public List<String> getErrors() {
        return errors;
    }

    @JsonProperty("security_headers")
    public Map<String, String> getSecurityHeaders() {
        return securityHeaders;
    }

    @JsonIgnore
    public List<Detection> getFindings() {
        return findings;
    }

    @Override
    public String toString() {
        return "HealthRecord{" +
                "url='" + url + '\'' +
                ", status=" + status +
                ", statusCode=" + statusCode +
                ", responseTimeMs=" + responseTimeMs +
                ", errors=" + errors +
                '}';
    }
}
