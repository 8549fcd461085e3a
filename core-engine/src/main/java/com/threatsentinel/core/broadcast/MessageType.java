package com.threatsentinel.core.broadcast;

/**
 * Envelope types sent to observers.
 */
public enum MessageType {
    ATTACK_DETECTED("attack_detected"),
    METRICS_UPDATE("metrics_update"),
    SIMULATION_STATUS("simulation_status"),
    WEBSITE_HEALTH("website_health");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return value of the {@code type} field on the wire
     */
    public String wireName() {
        return wireName;
    }
}
