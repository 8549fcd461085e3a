package com.threatsentinel.core.monitor;

import com.threatsentinel.core.model.HealthRecord;
import com.threatsentinel.core.model.MonitorConfig;
import com.threatsentinel.core.runtime.BoundedHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Background loop checking one target.
 *
 * <p>
 * Each iteration runs a check, appends the record to the bounded history and
 * hands it to the listener, then waits for the next cadence or a stop signal,
 * whichever comes first. A failing check or listener is logged and the loop
 * continues; only {@link #signalStop()} or an interrupt ends it. A record
 * produced after the stop signal is discarded.
 * </p>
 *
 * @since 1.0.0
 */
class MonitorTask implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorTask.class);

    private final MonitorConfig config;
    private final MonitorBackend backend;
    private final BoundedHistory<HealthRecord> history;
    private final Consumer<HealthRecord> listener;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile Future<?> handle;

    MonitorTask(MonitorConfig config, MonitorBackend backend, int historySize, Consumer<HealthRecord> listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.history = new BoundedHistory<>(historySize);
    }

    @Override
    public void run() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Monitoring {} every {}s", config.getUrl(), config.getCheckIntervalSeconds());
        try {
            do {
                checkOnce();
            } while (!stopSignal.await(config.getCheckIntervalSeconds(), TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            terminated.countDown();
            LOG.info("Stopped monitoring {}", config.getUrl());
        }
    }

    private void checkOnce() {
        HealthRecord record;
        try {
            record = backend.check(config);
        } catch (RuntimeException e) {
            LOG.error("Health check for {} failed, retrying next cycle: {}", config.getUrl(), e.getMessage(), e);
            return;
        }
        if (stopSignal.getCount() == 0) {
            LOG.debug("Discarding health record for {} received after stop", config.getUrl());
            return;
        }
        history.add(record);
        try {
            listener.accept(record);
        } catch (RuntimeException e) {
            LOG.error("Handling health record for {} failed: {}", config.getUrl(), e.getMessage(), e);
        }
    }

    void signalStop() {
        stopSignal.countDown();
    }

    /**
     * @param timeout maximum wait
     * @return {@code true} if the loop ended within {@code timeout}
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Interrupt the loop's thread; used when it does not react to the stop
     * signal in time. A loop that never started is marked terminated here.
     */
    void cancel() {
        Future<?> f = handle;
        if (started.compareAndSet(false, true)) {
            if (f != null) {
                f.cancel(false);
            }
            terminated.countDown();
            return;
        }
        if (f != null) {
            f.cancel(true);
        }
    }

    void attach(Future<?> handle) {
        this.handle = handle;
    }

    boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    MonitorConfig getConfig() {
        return config;
    }

    BoundedHistory<HealthRecord> getHistory() {
        return history;
    }
}
