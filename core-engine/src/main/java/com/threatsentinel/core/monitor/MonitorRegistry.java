package com.threatsentinel.core.monitor;

import com.threatsentinel.core.broadcast.MessageType;
import com.threatsentinel.core.incident.IncidentResponder;
import com.threatsentinel.core.model.Detection;
import com.threatsentinel.core.model.HealthRecord;
import com.threatsentinel.core.model.MonitorConfig;
import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.runtime.SentinelContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps at most one {@link MonitorTask} per target URL.
 *
 * <p>
 * Each health record is broadcast as {@code website_health}; findings of
 * severity HIGH or above are raised as website incidents through the
 * {@link IncidentResponder}.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorRegistry implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorRegistry.class);

    /** How long {@link #stop(String)} waits for a task before interrupting it. */
    static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private final SentinelContext context;
    private final MonitorBackend backend;
    private final IncidentResponder responder;
    private final Duration stopTimeout;
    private final Map<String, MonitorTask> tasks = new ConcurrentHashMap<>();

    public MonitorRegistry(SentinelContext context, MonitorBackend backend, IncidentResponder responder) {
        this(context, backend, responder, STOP_TIMEOUT);
    }

    MonitorRegistry(SentinelContext context, MonitorBackend backend, IncidentResponder responder,
            Duration stopTimeout) {
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.responder = Objects.requireNonNull(responder, "responder must not be null");
    }

    /**
     * Validate {@code config} and start monitoring its URL.
     *
     * @param config target configuration as received
     * @return {@code STARTED}, or {@code ALREADY_MONITORING} if the normalised
     *         URL already has a task
     * @throws IllegalArgumentException if the URL or timeout is invalid
     */
    public synchronized MonitorStartResult start(MonitorConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        MonitorConfig normalized = config.normalized(context.getSettings().getMonitorMinIntervalSeconds());
        String url = normalized.getUrl();
        MonitorTask existing = tasks.get(url);
        if (existing != null && existing.isTerminated()) {
            tasks.remove(url, existing);
        } else if (existing != null) {
            LOG.info("Already monitoring {}", url);
            return new MonitorStartResult(MonitorStartResult.Outcome.ALREADY_MONITORING, url);
        }
        MonitorTask task = new MonitorTask(normalized, backend,
                context.getSettings().getMonitorHistorySize(), this::onRecord);
        tasks.put(url, task);
        task.attach(context.getSupervisor().submit("monitor-" + url, task));
        return new MonitorStartResult(MonitorStartResult.Outcome.STARTED, url);
    }

    /**
     * Stop monitoring {@code url}: signal the task and wait until its loop has
     * ended, then deregister it. The target stays registered while stopping,
     * so a concurrent {@link #start} for it reports {@code ALREADY_MONITORING}.
     *
     * @param url target URL, as registered or in its raw form
     * @throws MonitorNotFoundException if the URL is not monitored
     */
    public void stop(String url) {
        MonitorTask task;
        synchronized (this) {
            String key = resolveKey(url);
            task = key != null ? tasks.get(key) : null;
            if (task == null) {
                throw new MonitorNotFoundException(url);
            }
        }
        if (terminate(task)) {
            tasks.remove(task.getConfig().getUrl(), task);
        }
    }

    private String resolveKey(String url) {
        if (url == null) {
            return null;
        }
        if (tasks.containsKey(url)) {
            return url;
        }
        try {
            String normalized = new MonitorConfig(url)
                    .normalized(context.getSettings().getMonitorMinIntervalSeconds())
                    .getUrl();
            return tasks.containsKey(normalized) ? normalized : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Signal {@code task}, interrupt it after the stop timeout, and keep
     * waiting until it acknowledges termination.
     *
     * @return {@code false} only if the calling thread was interrupted first
     */
    private boolean terminate(MonitorTask task) {
        String url = task.getConfig().getUrl();
        task.signalStop();
        try {
            if (task.awaitTermination(stopTimeout)) {
                return true;
            }
            LOG.warn("Monitor for {} did not stop within {}, interrupting", url, stopTimeout);
            task.cancel();
            while (!task.awaitTermination(stopTimeout)) {
                LOG.warn("Monitor for {} still running after interrupt, waiting", url);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel();
            LOG.warn("Interrupted while stopping monitor for {}, it stays registered until it ends", url);
            return task.isTerminated();
        }
    }

    /**
     * Stop every task. Tasks that already ended or fail to stop are logged
     * and skipped.
     */
    public void stopAll() {
        List<MonitorTask> all = new ArrayList<>(tasks.values());
        all.forEach(MonitorTask::signalStop);
        for (MonitorTask task : all) {
            boolean ended;
            try {
                ended = terminate(task);
            } catch (RuntimeException e) {
                LOG.warn("Error stopping monitor for {}: {}", task.getConfig().getUrl(), e.getMessage());
                ended = task.isTerminated();
            }
            if (ended) {
                tasks.remove(task.getConfig().getUrl(), task);
            }
        }
        if (!all.isEmpty()) {
            LOG.info("Stopped {} monitor(s)", all.size());
        }
    }

    /**
     * @return every monitored target with its latest health record
     */
    public List<MonitorStatus> list() {
        List<MonitorStatus> result = new ArrayList<>();
        for (MonitorTask task : tasks.values()) {
            result.add(new MonitorStatus(task.getConfig(), task.getHistory().latest()));
        }
        return result;
    }

    /**
     * @param url normalised target URL
     * @return health records for {@code url}, oldest first; empty if unknown
     */
    public List<HealthRecord> history(String url) {
        MonitorTask task = tasks.get(url);
        return task == null ? List.of() : task.getHistory().snapshot();
    }

    public boolean isMonitoring(String url) {
        return resolveKey(url) != null;
    }

    private void onRecord(HealthRecord record) {
        context.getHub().broadcast(MessageType.WEBSITE_HEALTH, record);
        for (Detection finding : record.findingsAtLeast(Severity.HIGH)) {
            responder.respondToMonitor(record, finding);
        }
    }

    @Override
    public void close() {
        stopAll();
    }
}
