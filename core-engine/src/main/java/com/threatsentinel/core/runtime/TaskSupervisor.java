package com.threatsentinel.core.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns every background task of the engine.
 *
 * <p>
 * Fire-and-forget work (incident persistence, broadcasts, enrichment,
 * simulations, monitor loops) goes through {@link #submit(String, Runnable)}
 * and is tracked until it finishes; periodic work goes through
 * {@link #scheduleAtFixedRate}. Failures are logged, never rethrown.
 * {@link #close()} cancels periodic work, waits for tracked tasks, then
 * interrupts whatever is left, so no task outlives the engine.
 * </p>
 *
 * @since 1.0.0
 */
public class TaskSupervisor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TaskSupervisor.class);

    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final Duration shutdownTimeout;

    /**
     * @param shutdownTimeout how long {@link #close()} waits for running tasks
     */
    public TaskSupervisor(Duration shutdownTimeout) {
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
        this.workers = Executors.newCachedThreadPool(daemonThreads("sentinel-task"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("sentinel-scheduler"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Run {@code task} in the background.
     *
     * @param name label used in log messages
     * @param task work to run
     * @return handle for cancellation and awaiting termination
     * @throws IllegalStateException if the supervisor is closed
     */
    public Future<?> submit(String name, Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        FutureTask<Void> handle = new FutureTask<>(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Background task [{}] failed: {}", name, e.getMessage(), e);
            }
        }, null) {
            @Override
            protected void done() {
                inFlight.remove(this);
            }
        };
        inFlight.add(handle);
        try {
            workers.execute(handle);
        } catch (RejectedExecutionException e) {
            inFlight.remove(handle);
            throw new IllegalStateException("Task supervisor is shut down, cannot run [" + name + "]", e);
        }
        return handle;
    }

    /**
     * Run {@code task} periodically until cancelled or closed.
     *
     * @param name   label used in log messages
     * @param task   work to run; an exception is logged and the schedule
     *               continues
     * @param period period between runs
     * @return handle for cancellation
     */
    public ScheduledFuture<?> scheduleAtFixedRate(String name, Runnable task, Duration period) {
        Objects.requireNonNull(task, "task must not be null");
        long millis = period.toMillis();
        return scheduler.scheduleAtFixedRate(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Periodic task [{}] failed: {}", name, e.getMessage(), e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Wait until every task submitted so far has finished.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if all finished in time
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!inFlight.isEmpty()) {
            List<Future<?>> snapshot = new ArrayList<>(inFlight);
            for (Future<?> f : snapshot) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                try {
                    f.get(remaining, TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    return false;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                } catch (ExecutionException | CancellationException e) {
                    LOG.trace("Awaited task ended abnormally: {}", e.getMessage());
                }
                inFlight.remove(f);
            }
        }
        return true;
    }

    /**
     * @return number of submitted tasks not yet finished
     */
    public int activeCount() {
        return inFlight.size();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("{} background task(s) still running after {}, interrupting",
                        inFlight.size(), shutdownTimeout);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        inFlight.clear();
        LOG.info("Task supervisor stopped");
    }
}
