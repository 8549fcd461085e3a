package com.threatsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Security-relevant event submitted by a client.
 *
 * <p>
 * The payload is kept as a free-form {@link Map} so detectors can query
 * arbitrary fields without a rigid schema. Instances are immutable: every
 * collection is copied on construction and exposed read-only.
 * </p>
 *
 * <h3>Wire format</h3>
 *
 * <pre>
 * {
 *   "event_type": "login_failure",
 *   "user_id": "alice",
 *   "data": {"username": "alice"},
 *   "source_ip": "10.0.0.5",
 *   "headers": {"User-Agent": "curl/8.0"},
 *   "session_id": "s-42"
 * }
 * </pre>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SecurityEvent {

    private final String eventType;
    private final String userId;
    private final Map<String, Object> payload;
    private final String sourceIp;
    private final Map<String, String> headers;
    private final String sessionId;
    private final String userAgent;
    private final Instant receivedAt;

    private SecurityEvent(Builder b) {
        this.eventType = b.eventType;
        this.userId = b.userId;
        this.payload = b.payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.payload))
                : Collections.emptyMap();
        this.sourceIp = b.sourceIp;
        this.headers = b.headers != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.headers))
                : null;
        this.sessionId = b.sessionId;
        this.userAgent = b.userAgent;
        this.receivedAt = b.receivedAt;
    }

    /**
     * Jackson entry point. Unknown properties are ignored; {@code receivedAt}
     * is stamped by the intake layer.
     */
    @JsonCreator
    static SecurityEvent fromJson(@JsonProperty("event_type") String eventType,
            @JsonProperty("user_id") String userId,
            @JsonProperty("data") @JsonAlias("payload") Map<String, Object> payload,
            @JsonProperty("source_ip") String sourceIp,
            @JsonProperty("headers") Map<String, String> headers,
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("user_agent") String userAgent) {
        return builder()
                .eventType(eventType)
                .userId(userId)
                .payload(payload)
                .sourceIp(sourceIp)
                .headers(headers)
                .sessionId(sessionId)
                .userAgent(userAgent)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start a builder pre-populated with this event's values.
     *
     * @return builder copy
     */
    public Builder toBuilder() {
        return new Builder()
                .eventType(eventType)
                .userId(userId)
                .payload(payload)
                .sourceIp(sourceIp)
                .headers(headers)
                .sessionId(sessionId)
                .userAgent(userAgent)
                .receivedAt(receivedAt);
    }

    /**
     * Fluent builder for {@link SecurityEvent}.
     */
    public static class Builder {
        private String eventType;
        private String userId;
        private Map<String, Object> payload;
        private String sourceIp;
        private Map<String, String> headers;
        private String sessionId;
        private String userAgent;
        private Instant receivedAt;

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload != null ? new LinkedHashMap<>(payload) : null;
            return this;
        }

        /**
         * Add a single payload entry.
         *
         * @param key   payload key
         * @param value payload value
         * @return this builder
         */
        public Builder field(String key, Object value) {
            Objects.requireNonNull(key, "Field key must not be null");
            if (payload == null) {
                payload = new LinkedHashMap<>();
            }
            payload.put(key, value);
            return this;
        }

        public Builder sourceIp(String sourceIp) {
            this.sourceIp = sourceIp;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public SecurityEvent build() {
            return new SecurityEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Payload accessors
    // ---------------------------------------------------------------

    /**
     * @param fieldName payload key
     * @return optional containing the raw value
     */
    public Optional<Object> getField(String fieldName) {
        return Optional.ofNullable(payload.get(fieldName));
    }

    /**
     * Retrieve a numeric payload value, coercing common JSON number types and
     * string-encoded numbers.
     *
     * @param fieldName payload key
     * @return optional containing the value as a {@code double}
     */
    public Optional<Double> getNumericField(String fieldName) {
        Object raw = payload.get(fieldName);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * @param fieldName payload key
     * @return optional containing the string form of the value
     */
    public Optional<String> getStringField(String fieldName) {
        Object raw = payload.get(fieldName);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    /**
     * Resolve an attribute by name. The top-level attributes
     * {@code source_ip}, {@code user_id}, {@code session_id} and
     * {@code event_type} are checked first, then the payload.
     *
     * @param name attribute or payload key
     * @return optional string value
     */
    public Optional<String> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name) {
            case "source_ip" -> Optional.ofNullable(sourceIp);
            case "user_id" -> Optional.ofNullable(userId);
            case "session_id" -> Optional.ofNullable(sessionId);
            case "event_type" -> Optional.ofNullable(eventType);
            default -> getStringField(name);
        };
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("event_type")
    public String getEventType() {
        return eventType;
    }

    @JsonProperty("user_id")
    public String getUserId() {
        return userId;
    }

    @JsonProperty("data")
    public Map<String, Object> getPayload() {
        return payload;
    }

    @JsonProperty("source_ip")
    public String getSourceIp() {
        return sourceIp;
    }

    @JsonProperty("headers")
    public Map<String, String> getHeaders() {
        return headers;
    }

    @JsonProperty("session_id")
    public String getSessionId() {
        return sessionId;
    }

    @JsonProperty("user_agent")
    public String getUserAgent() {
        return userAgent;
    }

    /**
     * @return the instant the event entered the pipeline, or {@code null}
     */
    @JsonIgnore
    public Instant getReceivedAt() {
        return receivedAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SecurityEvent that))
            return false;
        return Objects.equals(eventType, that.eventType)
                && Objects.equals(userId, that.userId)
                && Objects.equals(payload, that.payload)
                && Objects.equals(sourceIp, that.sourceIp)
                && Objects.equals(sessionId, that.sessionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, userId, payload, sourceIp, sessionId);
    }

    @Override
    public String toString() {
        return "SecurityEvent{" +
                "eventType='" + eventType + '\'' +
                ", sourceIp='" + sourceIp + '\'' +
                ", userId='" + userId + '\'' +
                ", payloadKeys=" + payload.keySet() +
                '}';
    }
}
