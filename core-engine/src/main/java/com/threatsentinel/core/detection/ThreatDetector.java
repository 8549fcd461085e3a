package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.SecurityEvent;

import java.util.Optional;

/**
 * Contract for every detector stage in the pipeline.
 * <p>
 * One instance is shared by all concurrently processed events, so
 * implementations that accumulate observations (rate, statistical) must keep
 * their state thread-safe.
 * </p>
 * <p>
 * An implementation may throw any {@link RuntimeException}; the pipeline
 * treats a failing stage as "no detection" and moves on.
 * </p>
 */
public interface ThreatDetector {

    /**
     * Classify a single event.
     *
     * @param event the incoming event
     * @return a {@link Detection} if the event matches, empty otherwise
     */
    Optional<Detection> evaluate(SecurityEvent event);

    /**
     * Return the unique name of the rule this detector enforces.
     *
     * @return rule name
     */
    String getRuleName();
}
