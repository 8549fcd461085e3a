package com.threatsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Incident raised for an event (or monitor check) that produced at least one
 * detection.
 *
 * <p>
 * A report is created synchronously with {@link GeoLocation#PENDING} and
 * later re-issued by {@link #withLocation(GeoLocation)} once geolocation
 * completes. Both versions share the same {@link #getIncidentId()}, which is
 * how observers correlate the follow-up with the original.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"incident_id", "origin", "attack_type", "severity", "description",
        "risk_score", "risk_factors", "timestamp", "ip"})
public final class IncidentReport {

    /** Source IP used for incidents raised by the website monitor. */
    public static final String MONITOR_SOURCE = "WEBSITE_MONITOR";

    /** Where an incident came from. */
    public enum Origin {
        EVENT,
        MONITOR
    }

    private final String incidentId;
    private final Origin origin;
    private final String attackType;
    private final Severity severity;
    private final String description;
    private final Map<String, Object> evidence;
    private final double riskScore;
    private final List<String> riskFactors;
    private final Instant timestamp;
    private final String sourceIp;
    private final String eventType;
    private final String userId;
    private final Map<String, Object> data;
    private final GeoLocation location;
    private final boolean update;

    private IncidentReport(Builder b) {
        this.incidentId = Objects.requireNonNull(b.incidentId, "incidentId must not be null");
        this.origin = b.origin != null ? b.origin : Origin.EVENT;
        Detection primary = Objects.requireNonNull(b.primary, "primary detection must not be null");
        RiskScore risk = Objects.requireNonNull(b.risk, "risk score must not be null");
        this.attackType = primary.getAttackType();
        this.description = primary.getDescription();
        this.evidence = primary.getEvidence();
        this.severity = risk.getSeverity();
        this.riskScore = risk.getScore();
        this.riskFactors = risk.getFactors();
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.sourceIp = b.sourceIp;
        this.eventType = b.eventType;
        this.userId = b.userId;
        this.data = b.data != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.data))
                : Collections.emptyMap();
        this.location = b.location != null ? b.location : GeoLocation.PENDING;
        this.update = false;
    }

    private IncidentReport(IncidentReport original, GeoLocation location) {
        this.incidentId = original.incidentId;
        this.origin = original.origin;
        this.attackType = original.attackType;
        this.severity = original.severity;
        this.description = original.description;
        this.evidence = original.evidence;
        this.riskScore = original.riskScore;
        this.riskFactors = original.riskFactors;
        this.timestamp = original.timestamp;
        this.sourceIp = original.sourceIp;
        this.eventType = original.eventType;
        this.userId = original.userId;
        this.data = original.data;
        this.location = Objects.requireNonNull(location, "location must not be null");
        this.update = true;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link IncidentReport}. The primary detection, the
     * risk score, the incident id and the timestamp are required.
     */
    public static class Builder {
        private String incidentId;
        private Origin origin;
        private Detection primary;
        private RiskScore risk;
        private Instant timestamp;
        private String sourceIp;
        private String eventType;
        private String userId;
        private Map<String, Object> data;
        private GeoLocation location;

        public Builder incidentId(String incidentId) {
            this.incidentId = incidentId;
            return this;
        }

        public Builder origin(Origin origin) {
            this.origin = origin;
            return this;
        }

        public Builder primary(Detection primary) {
            this.primary = primary;
            return this;
        }

        public Builder risk(RiskScore risk) {
            this.risk = risk;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder sourceIp(String sourceIp) {
            this.sourceIp = sourceIp;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder location(GeoLocation location) {
            this.location = location;
            return this;
        }

        public IncidentReport build() {
            return new IncidentReport(this);
        }
    }

    /**
     * Create the enriched follow-up of this report.
     *
     * @param location resolved location
     * @return a copy carrying {@code location} and flagged as an update
     */
    public IncidentReport withLocation(GeoLocation location) {
        return new IncidentReport(this, location);
    }

    @JsonProperty("incident_id")
    public String getIncidentId() {
        return incidentId;
    }

    @JsonProperty("origin")
    public Origin getOrigin() {
        return origin;
    }

    @JsonProperty("attack_type")
    public String getAttackType() {
        return attackType;
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("evidence")
    public Map<String, Object> getEvidence() {
        return evidence;
    }

    @JsonProperty("risk_score")
    public double getRiskScore() {
        return riskScore;
    }

    @JsonProperty("risk_factors")
    public List<String> getRiskFactors() {
        return riskFactors;
    }

    /**
     * @return the risk score this report was built from
     */
    @JsonIgnore
    public RiskScore getRisk() {
        return new RiskScore(riskScore, severity, riskFactors);
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("ip")
    public String getSourceIp() {
        return sourceIp;
    }

    @JsonProperty("event_type")
    public String getEventType() {
        return eventType;
    }

    @JsonProperty("user_id")
    public String getUserId() {
        return userId;
    }

    @JsonProperty("data")
    public Map<String, Object> getData() {
        return data;
    }

    @JsonUnwrapped
    public GeoLocation getLocation() {
        return location;
    }

    @JsonProperty("update")
    public boolean isUpdate() {
        return update;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IncidentReport that))
            return false;
        return update == that.update
                && incidentId.equals(that.incidentId)
                && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(incidentId, update, location);
    }

    @Override
    public String toString() {
        return "IncidentReport{" +
                "incidentId='" + incidentId + '\'' +
                ", attackType='" + attackType + '\'' +
                ", severity=" + severity +
                ", riskScore=" + riskScore +
                ", ip='" + sourceIp + '\'' +
                ", update=" + update +
                '}';
    }
}
