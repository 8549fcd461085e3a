package com.threatsentinel.core.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of {@link MonitorRegistry#start}.
 */
public final class MonitorStartResult {

    /** Whether a new task was created. */
    public enum Outcome {
        STARTED,
        ALREADY_MONITORING
    }

    private final Outcome outcome;
    private final String url;

    MonitorStartResult(Outcome outcome, String url) {
        this.outcome = outcome;
        this.url = url;
    }

    @JsonProperty("status")
    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * @return normalised target URL
     */
    @JsonProperty("url")
    public String getUrl() {
        return url;
    }

    @JsonProperty("message")
    public String getMessage() {
        return outcome == Outcome.STARTED
                ? "Started monitoring " + url
                : "Already monitoring " + url;
    }

    @Override
    public String toString() {
        return "MonitorStartResult{" + outcome + ", url='" + url + "'}";
    }
}
