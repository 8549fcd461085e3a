package com.threatsentinel.core.incident;

import com.threatsentinel.core.broadcast.MessageType;
import com.threatsentinel.core.geo.GeoLocator;
import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.GeoLocation;
import com.threatsentinel.core.model.HealthRecord;
import com.threatsentinel.core.model.IncidentReport;
import com.threatsentinel.core.model.RiskScore;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.risk.RiskScorer;
import com.threatsentinel.core.runtime.SentinelContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns detections into an {@link IncidentReport} and fans it out.
 *
 * <p>
 * The report is built and recorded in the bounded history synchronously.
 * Persistence, the first {@code attack_detected} broadcast and, for event
 * incidents, the geolocation follow-up run on the task supervisor; their
 * failures are logged and never reach the caller. The follow-up carries the
 * same incident id with {@code update=true}.
 * </p>
 *
 * @since 1.0.0
 */
public class IncidentResponder {

    private static final Logger LOG = LoggerFactory.getLogger(IncidentResponder.class);

    /** Event type recorded on incidents raised by endpoint monitors. */
    public static final String MONITOR_EVENT_TYPE = "website_monitor";

    private final SentinelContext context;
    private final RiskScorer scorer;
    private final IncidentLog incidentLog;
    private final GeoLocator geoLocator;

    public IncidentResponder(SentinelContext context, RiskScorer scorer, IncidentLog incidentLog,
            GeoLocator geoLocator) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.incidentLog = Objects.requireNonNull(incidentLog, "incidentLog must not be null");
        this.geoLocator = Objects.requireNonNull(geoLocator, "geoLocator must not be null");
    }

    /**
     * Handle detections raised for a submitted event.
     *
     * @param event      the event
     * @param detections its detections, non-empty, in pipeline order
     * @return the initial report (location pending)
     */
    public IncidentReport respond(SecurityEvent event, List<Detection> detections) {
        Objects.requireNonNull(event, "event must not be null");
        RiskScore risk = scorer.score(detections);
        IncidentReport report = IncidentReport.builder()
                .incidentId(UUID.randomUUID().toString())
                .origin(IncidentReport.Origin.EVENT)
                .primary(RiskScorer.primary(detections))
                .risk(risk)
                .timestamp(context.getClock().instant())
                .sourceIp(event.getSourceIp())
                .eventType(event.getEventType())
                .userId(event.getUserId())
                .data(event.getPayload())
                .build();

        context.getAttackHistory().add(report);
        LOG.warn("Incident {}: {} {} from {} (score={})", report.getIncidentId(), report.getSeverity(),
                report.getAttackType(), report.getSourceIp(), risk.getScore());
        dispatch(report, true);
        return report;
    }

    /**
     * Handle a monitor finding. No rate limiting and no geolocation apply.
     *
     * @param record  the health check that produced the finding
     * @param finding the finding
     * @return the report
     */
    public IncidentReport respondToMonitor(HealthRecord record, Detection finding) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(finding, "finding must not be null");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("url", record.getUrl());
        data.put("status", record.getStatus().name());
        data.put("status_code", record.getStatusCode());
        data.put("response_time_ms", record.getResponseTimeMs());

        IncidentReport report = IncidentReport.builder()
                .incidentId(UUID.randomUUID().toString())
                .origin(IncidentReport.Origin.MONITOR)
                .primary(finding)
                .risk(scorer.score(List.of(finding)))
                .timestamp(context.getClock().instant())
                .sourceIp(IncidentReport.MONITOR_SOURCE)
                .eventType(MONITOR_EVENT_TYPE)
                .data(data)
                .location(GeoLocation.UNKNOWN)
                .build();

        context.getWebsiteIncidents().add(report);
        LOG.warn("Website incident {}: {} {} for {}", report.getIncidentId(), report.getSeverity(),
                report.getAttackType(), record.getUrl());
        dispatch(report, false);
        return report;
    }

    private void dispatch(IncidentReport report, boolean enrich) {
        String id = report.getIncidentId();
        context.getSupervisor().submit("persist-" + id, () -> incidentLog.append(report));
        context.getSupervisor().submit("broadcast-" + id, () -> {
            context.getHub().broadcast(MessageType.ATTACK_DETECTED, report);
            if (enrich) {
                GeoLocation location = geoLocator.locate(report.getSourceIp());
                context.getHub().broadcast(MessageType.ATTACK_DETECTED, report.withLocation(location));
            }
        });
    }
}
