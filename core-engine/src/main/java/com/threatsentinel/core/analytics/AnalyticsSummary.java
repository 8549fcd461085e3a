package com.threatsentinel.core.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated view of recent incidents.
 *
 * @since 1.0.0
 */
public final class AnalyticsSummary {

    private final Map<String, Long> attackTypeCounts;
    private final Map<String, Long> websiteIncidentCounts;
    private final int totalThreatEvents;
    private final int totalWebsiteIncidents;
    private final int threatIntelligenceIpCount;
    private final int rateLimitedIpCount;
    private final Map<String, Long> topAttackingIps;

    AnalyticsSummary(Map<String, Long> attackTypeCounts, Map<String, Long> websiteIncidentCounts,
            int totalThreatEvents, int totalWebsiteIncidents, int threatIntelligenceIpCount,
            int rateLimitedIpCount, Map<String, Long> topAttackingIps) {
        this.attackTypeCounts = Map.copyOf(attackTypeCounts);
        this.websiteIncidentCounts = Map.copyOf(websiteIncidentCounts);
        this.totalThreatEvents = totalThreatEvents;
        this.totalWebsiteIncidents = totalWebsiteIncidents;
        this.threatIntelligenceIpCount = threatIntelligenceIpCount;
        this.rateLimitedIpCount = rateLimitedIpCount;
        this.topAttackingIps = Collections.unmodifiableMap(new LinkedHashMap<>(topAttackingIps));
    }

    @JsonProperty("attack_type_counts")
    public Map<String, Long> getAttackTypeCounts() {
        return attackTypeCounts;
    }

    @JsonProperty("website_incident_counts")
    public Map<String, Long> getWebsiteIncidentCounts() {
        return websiteIncidentCounts;
    }

    @JsonProperty("total_threat_events")
    public int getTotalThreatEvents() {
        return totalThreatEvents;
    }

    @JsonProperty("total_website_incidents")
    public int getTotalWebsiteIncidents() {
        return totalWebsiteIncidents;
    }

    @JsonProperty("threat_intelligence_ip_count")
    public int getThreatIntelligenceIpCount() {
        return threatIntelligenceIpCount;
    }

    @JsonProperty("rate_limited_ip_count")
    public int getRateLimitedIpCount() {
        return rateLimitedIpCount;
    }

    /**
     * @return IP to incident count, highest first
     */
    @JsonProperty("top_attacking_ips_last_hour")
    public Map<String, Long> getTopAttackingIps() {
        return topAttackingIps;
    }
}
