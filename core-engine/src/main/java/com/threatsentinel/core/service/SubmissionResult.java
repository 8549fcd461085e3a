package com.threatsentinel.core.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.threatsentinel.core.model.IncidentReport;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of submitting one event.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SubmissionResult {

    /** Classification of the submission. */
    public enum Status {
        NO_THREAT,
        THREAT_DETECTED,
        REJECTED
    }

    static final int HTTP_OK = 200;
    static final int HTTP_FORBIDDEN = 403;
    static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final Status status;
    private final int httpStatus;
    private final String message;
    private final IncidentReport report;

    private SubmissionResult(Status status, int httpStatus, String message, IncidentReport report) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.httpStatus = httpStatus;
        this.message = message;
        this.report = report;
    }

    static SubmissionResult noThreat() {
        return new SubmissionResult(Status.NO_THREAT, HTTP_OK, "No threat detected", null);
    }

    static SubmissionResult threatDetected(IncidentReport report) {
        return new SubmissionResult(Status.THREAT_DETECTED, HTTP_OK,
                "Threat detected: " + report.getAttackType(), report);
    }

    static SubmissionResult blocked(IncidentReport report) {
        return new SubmissionResult(Status.REJECTED, HTTP_FORBIDDEN,
                "Access denied due to high-risk activity.", report);
    }

    static SubmissionResult alreadyRateLimited() {
        return new SubmissionResult(Status.REJECTED, HTTP_TOO_MANY_REQUESTS,
                "Too many requests: source is temporarily blocked.", null);
    }

    @JsonProperty("status")
    public Status getStatus() {
        return status;
    }

    @JsonIgnore
    public int httpStatus() {
        return httpStatus;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("incident_details")
    public IncidentReport getReportOrNull() {
        return report;
    }

    @JsonIgnore
    public Optional<IncidentReport> getReport() {
        return Optional.ofNullable(report);
    }

    @Override
    public String toString() {
        return "SubmissionResult{" + status + ", http=" + httpStatus + ", report="
                + (report != null ? report.getIncidentId() : "none") + '}';
    }
}
