package com.threatsentinel.core.service;

import com.threatsentinel.core.incident.IncidentResponder;
import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.IncidentReport;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.pipeline.DetectionPipeline;
import com.threatsentinel.core.ratelimit.AdaptiveRateLimiter;
import com.threatsentinel.core.runtime.SentinelContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for submitted events.
 *
 * <ol>
 * <li>The request is counted.</li>
 * <li>A source that is currently blocked is rejected with 429 without
 * running the pipeline.</li>
 * <li>No detection: {@code NO_THREAT}.</li>
 * <li>Otherwise the event is counted as an error event and handed to the
 * {@link IncidentResponder}.</li>
 * <li>A high-risk incident blocks its source and is rejected with 403; any
 * other incident is reported as {@code THREAT_DETECTED}.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class ThreatSentinelService {

    private static final Logger LOG = LoggerFactory.getLogger(ThreatSentinelService.class);

    private final SentinelContext context;
    private final DetectionPipeline pipeline;
    private final IncidentResponder responder;

    public ThreatSentinelService(SentinelContext context, DetectionPipeline pipeline, IncidentResponder responder) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.responder = Objects.requireNonNull(responder, "responder must not be null");
    }

    /**
     * @param event event to classify; {@code eventType} is required
     * @return the outcome
     * @throws IllegalArgumentException if the event has no type
     */
    public SubmissionResult submitEvent(SecurityEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (event.getEventType() == null || event.getEventType().isBlank()) {
            throw new IllegalArgumentException("event_type is required");
        }
        Instant now = context.getClock().instant();
        if (event.getReceivedAt() == null) {
            event = event.toBuilder().receivedAt(now).build();
        }
        context.getRequests().record(now);

        AdaptiveRateLimiter limiter = context.getRateLimiter();
        String ip = event.getSourceIp();
        if (limiter.shouldBlock(ip)) {
            LOG.info("Rejected {} from rate-limited {}", event.getEventType(), ip);
            return SubmissionResult.alreadyRateLimited();
        }

        List<Detection> detections = pipeline.evaluate(event);
        if (detections.isEmpty()) {
            LOG.debug("Event {} from {}: no threat", event.getEventType(), ip);
            return SubmissionResult.noThreat();
        }

        context.getErrorEvents().record(now);
        IncidentReport report = responder.respond(event, detections);

        if (limiter.recordHighRisk(ip, report.getRisk())) {
            LOG.info("Event {} from {}: {} {}, responding 403",
                    event.getEventType(), ip, report.getSeverity(), report.getAttackType());
            return SubmissionResult.blocked(report);
        }
        LOG.info("Event {} from {}: {} {}, responding 200",
                event.getEventType(), ip, report.getSeverity(), report.getAttackType());
        return SubmissionResult.threatDetected(report);
    }
}
