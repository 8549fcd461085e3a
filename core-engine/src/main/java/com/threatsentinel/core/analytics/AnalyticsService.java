package com.threatsentinel.core.analytics;

import com.threatsentinel.core.model.IncidentReport;
import com.threatsentinel.core.runtime.SentinelContext;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes {@link AnalyticsSummary} from the bounded incident histories.
 *
 * @since 1.0.0
 */
public class AnalyticsService {

    static final int TOP_IP_LIMIT = 5;

    static final Duration TOP_IP_WINDOW = Duration.ofHours(1);

    private static final String WEBSITE_PREFIX = "WEBSITE_";

    private final SentinelContext context;
    private final int threatIntelligenceIpCount;

    /**
     * @param context                   shared state
     * @param threatIntelligenceIpCount number of configured blacklist entries
     */
    public AnalyticsService(SentinelContext context, int threatIntelligenceIpCount) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.threatIntelligenceIpCount = threatIntelligenceIpCount;
    }

    public AnalyticsSummary summarize() {
        List<IncidentReport> attacks = context.getAttackHistory().snapshot();
        List<IncidentReport> websiteIncidents = context.getWebsiteIncidents().snapshot();

        Map<String, Long> attackTypes = new HashMap<>();
        for (IncidentReport r : attacks) {
            attackTypes.merge(r.getAttackType(), 1L, Long::sum);
        }

        Map<String, Long> websiteTypes = new HashMap<>();
        for (IncidentReport r : websiteIncidents) {
            String type = r.getAttackType();
            if (type.startsWith(WEBSITE_PREFIX)) {
                type = type.substring(WEBSITE_PREFIX.length());
            }
            websiteTypes.merge(type, 1L, Long::sum);
        }

        Instant since = context.getClock().instant().minus(TOP_IP_WINDOW);
        Map<String, Long> perIp = new HashMap<>();
        for (IncidentReport r : attacks) {
            String ip = r.getSourceIp();
            if (ip != null && !IncidentReport.MONITOR_SOURCE.equals(ip) && r.getTimestamp().isAfter(since)) {
                perIp.merge(ip, 1L, Long::sum);
            }
        }
        Map<String, Long> topIps = new LinkedHashMap<>();
        perIp.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_IP_LIMIT)
                .forEach(e -> topIps.put(e.getKey(), e.getValue()));

        return new AnalyticsSummary(attackTypes, websiteTypes, attacks.size(), websiteIncidents.size(),
                threatIntelligenceIpCount, context.getRateLimiter().activeBlockCount(), topIps);
    }
}
