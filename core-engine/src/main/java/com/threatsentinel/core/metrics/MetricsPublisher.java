package com.threatsentinel.core.metrics;

import com.threatsentinel.core.broadcast.MessageType;
import com.threatsentinel.core.runtime.SentinelContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic metrics loop.
 *
 * <p>
 * Every {@code metricsInterval} it prunes both sliding-window counters to
 * {@code metricsWindow}, builds a {@link MetricsSnapshot} and hands its
 * {@code metrics_update} broadcast to a supervised task, so a slow observer
 * never delays the next tick. A failing tick is logged by the supervisor and
 * the loop carries on.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricsPublisher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsPublisher.class);

    private final SentinelContext context;
    private ScheduledFuture<?> schedule;

    public MetricsPublisher(SentinelContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    /**
     * Start the periodic loop; a second call is a no-op.
     */
    public synchronized void start() {
        if (schedule != null) {
            return;
        }
        schedule = context.getSupervisor().scheduleAtFixedRate(
                "metrics", this::tick, context.getSettings().getMetricsInterval());
        LOG.info("Metrics publisher started (interval={})", context.getSettings().getMetricsInterval());
    }

    /**
     * Run one iteration: prune, snapshot, then submit the broadcast.
     *
     * @return the snapshot being broadcast
     */
    public MetricsSnapshot tick() {
        Instant cutoff = context.getClock().instant().minus(context.getSettings().getMetricsWindow());
        context.getRequests().prune(cutoff);
        context.getErrorEvents().prune(cutoff);
        MetricsSnapshot snapshot = snapshot();
        try {
            context.getSupervisor().submit("metrics-broadcast",
                    () -> context.getHub().broadcast(MessageType.METRICS_UPDATE, snapshot));
        } catch (IllegalStateException e) {
            LOG.debug("Skipping metrics broadcast: {}", e.getMessage());
        }
        return snapshot;
    }

    /**
     * @return current metrics without pruning or broadcasting
     */
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                context.getRequests().size(),
                context.getErrorEvents().size(),
                context.getHub().observerCount(),
                context.getBreaker().status(),
                context.getRateLimiter().activeBlockCount(),
                context.getClock().instant());
    }

    /**
     * Cancel the loop; an iteration in progress is allowed to finish.
     */
    @Override
    public synchronized void close() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
            LOG.info("Metrics publisher stopped");
        }
    }
}
