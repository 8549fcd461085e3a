package com.threatsentinel.core.engine;

import com.threatsentinel.core.analytics.AnalyticsService;
import com.threatsentinel.core.config.RulesConfig;
import com.threatsentinel.core.config.RulesLoader;
import com.threatsentinel.core.config.SentinelSettings;
import com.threatsentinel.core.detection.BlacklistDetector;
import com.threatsentinel.core.geo.GeoLocator;
import com.threatsentinel.core.geo.HttpGeoLocator;
import com.threatsentinel.core.incident.IncidentLog;
import com.threatsentinel.core.incident.IncidentResponder;
import com.threatsentinel.core.incident.JsonFileIncidentLog;
import com.threatsentinel.core.incident.PiiMasker;
import com.threatsentinel.core.metrics.MetricsPublisher;
import com.threatsentinel.core.monitor.HttpMonitorBackend;
import com.threatsentinel.core.monitor.MonitorBackend;
import com.threatsentinel.core.monitor.MonitorRegistry;
import com.threatsentinel.core.pipeline.DetectionPipeline;
import com.threatsentinel.core.risk.RiskScorer;
import com.threatsentinel.core.runtime.SentinelContext;
import com.threatsentinel.core.service.ThreatSentinelService;
import com.threatsentinel.core.simulation.AttackSimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the engine components around one {@link SentinelContext}.
 *
 * <p>
 * {@link #start()} launches the metrics loop; {@link #close()} stops the
 * monitors, the metrics loop and finally the task supervisor, in that order.
 * Collaborators that talk to the outside world (incident log, geolocation,
 * monitor backend) can be replaced through the {@link Builder}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelEngine.class);

    private final SentinelContext context;
    private final DetectionPipeline pipeline;
    private final IncidentLog incidentLog;
    private final ThreatSentinelService service;
    private final MonitorRegistry monitors;
    private final MetricsPublisher metrics;
    private final AnalyticsService analytics;
    private final AttackSimulator simulator;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private SentinelEngine(Builder b) {
        SentinelSettings settings = b.settings != null ? b.settings : SentinelSettings.defaults();
        Clock clock = b.clock != null ? b.clock : Clock.systemUTC();
        RulesConfig rules = b.rules != null ? b.rules : loadRules(settings);

        this.context = new SentinelContext(settings, clock);
        this.pipeline = DetectionPipeline.fromRules(rules, context.getBreaker());
        this.incidentLog = b.incidentLog != null
                ? b.incidentLog
                : new JsonFileIncidentLog(Path.of(settings.getIncidentLogPath()), new PiiMasker(settings.getPiiFields()));
        GeoLocator geo = b.geoLocator != null ? b.geoLocator : new HttpGeoLocator(settings.getGeoLookupUrl());
        MonitorBackend backend = b.monitorBackend != null ? b.monitorBackend : new HttpMonitorBackend(clock);

        IncidentResponder responder = new IncidentResponder(
                context, new RiskScorer(settings.getSeverityUpgradeThreshold()), incidentLog, geo);
        this.service = new ThreatSentinelService(context, pipeline, responder);
        this.monitors = new MonitorRegistry(context, backend, responder);
        this.metrics = new MetricsPublisher(context);
        this.analytics = new AnalyticsService(context, threatIntelligenceSize(pipeline));
        this.simulator = new AttackSimulator(service, context.getHub(), context.getSupervisor());

        LOG.info("Engine assembled: {} cheap stage(s), expensive stage {}",
                pipeline.getStages().size(),
                pipeline.getExpensiveStage().map(s -> "'" + s.getRuleName() + "'").orElse("disabled"));
    }

    private static RulesConfig loadRules(SentinelSettings settings) {
        String path = settings.getRulesConfigPath();
        return path == null || path.isBlank() ? RulesLoader.load() : RulesLoader.fromFile(path);
    }

    private static int threatIntelligenceSize(DetectionPipeline pipeline) {
        return pipeline.getStages().stream()
                .filter(BlacklistDetector.class::isInstance)
                .mapToInt(s -> ((BlacklistDetector) s).size())
                .sum();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start the periodic metrics loop.
     *
     * @return this engine
     */
    public SentinelEngine start() {
        metrics.start();
        return this;
    }

    public SentinelContext getContext() {
        return context;
    }

    public DetectionPipeline getPipeline() {
        return pipeline;
    }

    public ThreatSentinelService getService() {
        return service;
    }

    public MonitorRegistry getMonitors() {
        return monitors;
    }

    public MetricsPublisher getMetrics() {
        return metrics;
    }

    public AnalyticsService getAnalytics() {
        return analytics;
    }

    public AttackSimulator getSimulator() {
        return simulator;
    }

    public IncidentLog getIncidentLog() {
        return incidentLog;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Shutting down engine");
        monitors.stopAll();
        metrics.close();
        context.close();
    }

    /**
     * Fluent builder for {@link SentinelEngine}. Unset collaborators fall back
     * to the production implementations configured from the settings.
     */
    public static class Builder {
        private SentinelSettings settings;
        private Clock clock;
        private RulesConfig rules;
        private IncidentLog incidentLog;
        private GeoLocator geoLocator;
        private MonitorBackend monitorBackend;

        public Builder settings(SentinelSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder rules(RulesConfig rules) {
            this.rules = rules;
            return this;
        }

        public Builder incidentLog(IncidentLog incidentLog) {
            this.incidentLog = incidentLog;
            return this;
        }

        public Builder geoLocator(GeoLocator geoLocator) {
            this.geoLocator = geoLocator;
            return this;
        }

        public Builder monitorBackend(MonitorBackend monitorBackend) {
            this.monitorBackend = monitorBackend;
            return this;
        }

        public SentinelEngine build() {
            return new SentinelEngine(this);
        }
    }
}
