package com.threatsentinel.core.metrics;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Bounded, ascending sequence of event timestamps.
 *
 * <p>
 * Appending beyond {@code maxEntries} evicts the oldest entry. Entries older
 * than a cutoff are removed by {@link #prune(Instant)}. All methods are
 * synchronized.
 * </p>
 *
 * @since 1.0.0
 */
public class SlidingWindowCounter {

    private final int maxEntries;
    private final Deque<Instant> timestamps = new ArrayDeque<>();

    /**
     * @param maxEntries capacity
     * @throws IllegalArgumentException if {@code maxEntries < 1}
     */
    public SlidingWindowCounter(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1, got: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    /**
     * Append a timestamp. A timestamp earlier than the newest entry is clamped
     * to it so the sequence stays ascending.
     *
     * @param at event time
     */
    public synchronized void record(Instant at) {
        Objects.requireNonNull(at, "timestamp must not be null");
        Instant last = timestamps.peekLast();
        timestamps.addLast(last != null && at.isBefore(last) ? last : at);
        while (timestamps.size() > maxEntries) {
            timestamps.pollFirst();
        }
    }

    /**
     * Drop every entry strictly older than {@code cutoff}.
     *
     * @param cutoff oldest instant to keep
     * @return number of entries removed
     */
    public synchronized int prune(Instant cutoff) {
        int removed = 0;
        while (!timestamps.isEmpty() && timestamps.peekFirst().isBefore(cutoff)) {
            timestamps.pollFirst();
            removed++;
        }
        return removed;
    }

    public synchronized int size() {
        return timestamps.size();
    }

    /**
     * @return oldest retained timestamp, or {@code null} when empty
     */
    public synchronized Instant oldest() {
        return timestamps.peekFirst();
    }

    public int getMaxEntries() {
        return maxEntries;
    }
}
