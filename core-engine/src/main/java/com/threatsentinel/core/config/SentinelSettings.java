package com.threatsentinel.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable runtime settings for Threat Sentinel.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable through container env vars or a shell
 * environment without any file.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelSettings {

    // ---------------------------------------------------------------
    // Adaptive response
    // ---------------------------------------------------------------
    private final Duration rateLimitDuration;
    private final double highRiskThreshold;
    private final double severityUpgradeThreshold;

    // ---------------------------------------------------------------
    // Circuit breaker (expensive detector)
    // ---------------------------------------------------------------
    private final int breakerFailureThreshold;
    private final Duration breakerFailureWindow;
    private final Duration breakerCooldown;

    // ---------------------------------------------------------------
    // Sliding-window metrics
    // ---------------------------------------------------------------
    private final Duration metricsInterval;
    private final Duration metricsWindow;
    private final int metricsMaxEntries;

    // ---------------------------------------------------------------
    // Monitors and histories
    // ---------------------------------------------------------------
    private final int monitorMinIntervalSeconds;
    private final int monitorHistorySize;
    private final int attackHistorySize;
    private final int websiteIncidentHistorySize;

    // ---------------------------------------------------------------
    // Incident log and enrichment
    // ---------------------------------------------------------------
    private final String incidentLogPath;
    private final List<String> piiFields;
    private final String geoLookupUrl;

    // ---------------------------------------------------------------
    // Transport
    // ---------------------------------------------------------------
    private final int httpPort;
    private final String rulesConfigPath;

    private SentinelSettings(Builder b) {
        this.rateLimitDuration = b.rateLimitDuration;
        this.highRiskThreshold = b.highRiskThreshold;
        this.severityUpgradeThreshold = b.severityUpgradeThreshold;
        this.breakerFailureThreshold = b.breakerFailureThreshold;
        this.breakerFailureWindow = b.breakerFailureWindow;
        this.breakerCooldown = b.breakerCooldown;
        this.metricsInterval = b.metricsInterval;
        this.metricsWindow = b.metricsWindow;
        this.metricsMaxEntries = b.metricsMaxEntries;
        this.monitorMinIntervalSeconds = b.monitorMinIntervalSeconds;
        this.monitorHistorySize = b.monitorHistorySize;
        this.attackHistorySize = b.attackHistorySize;
        this.websiteIncidentHistorySize = b.websiteIncidentHistorySize;
        this.incidentLogPath = b.incidentLogPath;
        this.piiFields = List.copyOf(b.piiFields);
        this.geoLookupUrl = b.geoLookupUrl;
        this.httpPort = b.httpPort;
        this.rulesConfigPath = b.rulesConfigPath;
    }

    /**
     * @return settings with every default applied
     */
    public static SentinelSettings defaults() {
        return new Builder().build();
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build {@link SentinelSettings} from environment variables.
     *
     * @return fully populated settings
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static SentinelSettings fromEnvironment() {
        try {
            return new Builder()
                    .rateLimitDuration(Duration.ofSeconds(parseLongEnv("RATE_LIMIT_DURATION_SECONDS", "300")))
                    .highRiskThreshold(Double.parseDouble(env("HIGH_RISK_THRESHOLD", "0.8")))
                    .severityUpgradeThreshold(Double.parseDouble(env("SEVERITY_UPGRADE_THRESHOLD", "0.95")))
                    .breakerFailureThreshold(parseIntEnv("LLM_FAILURE_THRESHOLD", "5"))
                    .breakerFailureWindow(Duration.ofSeconds(parseLongEnv("LLM_FAILURE_WINDOW_SECONDS", "60")))
                    .breakerCooldown(Duration.ofSeconds(parseLongEnv("LLM_COOLDOWN_SECONDS", "30")))
                    .metricsInterval(Duration.ofSeconds(parseLongEnv("METRICS_INTERVAL_SECONDS", "5")))
                    .metricsWindow(Duration.ofSeconds(parseLongEnv("TIME_WINDOW_SECONDS", "3600")))
                    .metricsMaxEntries(parseIntEnv("METRICS_MAX_ENTRIES", "500"))
                    .monitorMinIntervalSeconds(parseIntEnv("MONITOR_MIN_INTERVAL_SECONDS", "30"))
                    .monitorHistorySize(parseIntEnv("MONITOR_HISTORY_SIZE", "100"))
                    .attackHistorySize(parseIntEnv("ATTACK_HISTORY_SIZE", "1000"))
                    .websiteIncidentHistorySize(parseIntEnv("WEBSITE_INCIDENT_HISTORY_SIZE", "500"))
                    .incidentLogPath(env("LOG_JSON_FILE", "attack_log.json"))
                    .piiFields(List.of(env("PII_FIELDS", "email,phone,ssn,password,address,full_name")
                            .split("\\s*,\\s*")))
                    .geoLookupUrl(env("GEO_LOOKUP_URL", ""))
                    .httpPort(parseIntEnv("PORT", "8000"))
                    .rulesConfigPath(env("RULES_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Duration getRateLimitDuration() {
        return rateLimitDuration;
    }

    public double getHighRiskThreshold() {
        return highRiskThreshold;
    }

    public double getSeverityUpgradeThreshold() {
        return severityUpgradeThreshold;
    }

    public int getBreakerFailureThreshold() {
        return breakerFailureThreshold;
    }

    public Duration getBreakerFailureWindow() {
        return breakerFailureWindow;
    }

    public Duration getBreakerCooldown() {
        return breakerCooldown;
    }

    public Duration getMetricsInterval() {
        return metricsInterval;
    }

    public Duration getMetricsWindow() {
        return metricsWindow;
    }

    public int getMetricsMaxEntries() {
        return metricsMaxEntries;
    }

    public int getMonitorMinIntervalSeconds() {
        return monitorMinIntervalSeconds;
    }

    public int getMonitorHistorySize() {
        return monitorHistorySize;
    }

    public int getAttackHistorySize() {
        return attackHistorySize;
    }

    public int getWebsiteIncidentHistorySize() {
        return websiteIncidentHistorySize;
    }

    public String getIncidentLogPath() {
        return incidentLogPath;
    }

    public List<String> getPiiFields() {
        return piiFields;
    }

    /**
     * @return ip-api compatible lookup URL template containing {@code {ip}},
     *         or an empty string when geolocation is disabled
     */
    public String getGeoLookupUrl() {
        return geoLookupUrl;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link SentinelSettings}.
     *
     * <p>
     * {@link #build()} rejects non-positive durations and sizes, thresholds
     * outside {@code (0, 1]}, and ports outside {@code [0, 65535]} (0 binds an
     * ephemeral port).
     * </p>
     */
    public static class Builder {
        private Duration rateLimitDuration = Duration.ofSeconds(300);
        private double highRiskThreshold = 0.8;
        private double severityUpgradeThreshold = 0.95;
        private int breakerFailureThreshold = 5;
        private Duration breakerFailureWindow = Duration.ofSeconds(60);
        private Duration breakerCooldown = Duration.ofSeconds(30);
        private Duration metricsInterval = Duration.ofSeconds(5);
        private Duration metricsWindow = Duration.ofSeconds(3600);
        private int metricsMaxEntries = 500;
        private int monitorMinIntervalSeconds = 30;
        private int monitorHistorySize = 100;
        private int attackHistorySize = 1000;
        private int websiteIncidentHistorySize = 500;
        private String incidentLogPath = "attack_log.json";
        private List<String> piiFields = List.of("email", "phone", "ssn", "password", "address", "full_name");
        private String geoLookupUrl = "";
        private int httpPort = 8000;
        private String rulesConfigPath = "";

        public Builder rateLimitDuration(Duration v) {
            this.rateLimitDuration = v;
            return this;
        }

        public Builder highRiskThreshold(double v) {
            this.highRiskThreshold = v;
            return this;
        }

        public Builder severityUpgradeThreshold(double v) {
            this.severityUpgradeThreshold = v;
            return this;
        }

        public Builder breakerFailureThreshold(int v) {
            this.breakerFailureThreshold = v;
            return this;
        }

        public Builder breakerFailureWindow(Duration v) {
            this.breakerFailureWindow = v;
            return this;
        }

        public Builder breakerCooldown(Duration v) {
            this.breakerCooldown = v;
            return this;
        }

        public Builder metricsInterval(Duration v) {
            this.metricsInterval = v;
            return this;
        }

        public Builder metricsWindow(Duration v) {
            this.metricsWindow = v;
            return this;
        }

        public Builder metricsMaxEntries(int v) {
            this.metricsMaxEntries = v;
            return this;
        }

        public Builder monitorMinIntervalSeconds(int v) {
            this.monitorMinIntervalSeconds = v;
            return this;
        }

        public Builder monitorHistorySize(int v) {
            this.monitorHistorySize = v;
            return this;
        }

        public Builder attackHistorySize(int v) {
            this.attackHistorySize = v;
            return this;
        }

        public Builder websiteIncidentHistorySize(int v) {
            this.websiteIncidentHistorySize = v;
            return this;
        }

        public Builder incidentLogPath(String v) {
            this.incidentLogPath = v;
            return this;
        }

        public Builder piiFields(List<String> v) {
            this.piiFields = v;
            return this;
        }

        public Builder geoLookupUrl(String v) {
            this.geoLookupUrl = v;
            return this;
        }

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        /**
         * Build and validate the settings.
         *
         * @return validated {@link SentinelSettings}
         * @throws IllegalArgumentException if any value is invalid
         */
        public SentinelSettings build() {
            requirePositive(rateLimitDuration, "rateLimitDuration");
            requirePositive(breakerFailureWindow, "breakerFailureWindow");
            requirePositive(breakerCooldown, "breakerCooldown");
            requirePositive(metricsInterval, "metricsInterval");
            requirePositive(metricsWindow, "metricsWindow");
            requireNonBlank(incidentLogPath, "incidentLogPath");
            Objects.requireNonNull(piiFields, "piiFields required");
            Objects.requireNonNull(geoLookupUrl, "geoLookupUrl required");
            Objects.requireNonNull(rulesConfigPath, "rulesConfigPath required");

            requireUnitInterval(highRiskThreshold, "highRiskThreshold");
            requireUnitInterval(severityUpgradeThreshold, "severityUpgradeThreshold");
            requireAtLeast(breakerFailureThreshold, 1, "breakerFailureThreshold");
            requireAtLeast(metricsMaxEntries, 1, "metricsMaxEntries");
            requireAtLeast(monitorMinIntervalSeconds, 1, "monitorMinIntervalSeconds");
            requireAtLeast(monitorHistorySize, 1, "monitorHistorySize");
            requireAtLeast(attackHistorySize, 1, "attackHistorySize");
            requireAtLeast(websiteIncidentHistorySize, 1, "websiteIncidentHistorySize");
            if (httpPort < 0 || httpPort > 65_535) {
                throw new IllegalArgumentException("httpPort must be in [0, 65535], got: " + httpPort);
            }

            return new SentinelSettings(this);
        }

        private static void requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be a positive duration, got: " + value);
            }
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requireUnitInterval(double value, String name) {
            if (!(value > 0.0 && value <= 1.0)) {
                throw new IllegalArgumentException(name + " must be in (0, 1], got: " + value);
            }
        }

        private static void requireAtLeast(int value, int min, String name) {
            if (value < min) {
                throw new IllegalArgumentException(name + " must be >= " + min + ", got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "SentinelSettings{" +
                "rateLimitDuration=" + rateLimitDuration +
                ", highRiskThreshold=" + highRiskThreshold +
                ", breakerFailureThreshold=" + breakerFailureThreshold +
                ", breakerFailureWindow=" + breakerFailureWindow +
                ", breakerCooldown=" + breakerCooldown +
                ", metricsInterval=" + metricsInterval +
                ", metricsWindow=" + metricsWindow +
                ", incidentLogPath='" + incidentLogPath + '\'' +
                ", httpPort=" + httpPort +
                '}';
    }
}
