package com.threatsentinel.core.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.threatsentinel.core.model.HealthRecord;
import com.threatsentinel.core.model.MonitorConfig;

/**
 * A monitored target with its most recent health record.
 */
public final class MonitorStatus {

    private final MonitorConfig config;
    private final HealthRecord currentHealth;

    public MonitorStatus(MonitorConfig config, HealthRecord currentHealth) {
        this.config = config;
        this.currentHealth = currentHealth;
    }

    @JsonProperty("url")
    public String getUrl() {
        return config.getUrl();
    }

    @JsonProperty("config")
    public MonitorConfig getConfig() {
        return config;
    }

    /**
     * @return latest record, or {@code null} before the first check completes
     */
    @JsonProperty("current_health")
    public HealthRecord getCurrentHealth() {
        return currentHealth;
    }
}
