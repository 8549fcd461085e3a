package com.threatsentinel.core.runtime;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-capacity, insertion-ordered history; the oldest entry is dropped when
 * full. All methods are synchronized.
 *
 * @param <T> element type
 */
public class BoundedHistory<T> {

    private final int capacity;
    private final Deque<T> entries = new ArrayDeque<>();

    public BoundedHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void add(T entry) {
        entries.addLast(Objects.requireNonNull(entry, "entry must not be null"));
        if (entries.size() > capacity) {
            entries.pollFirst();
        }
    }

    /**
     * @return copy of the entries, oldest first
     */
    public synchronized List<T> snapshot() {
        return List.copyOf(entries);
    }

    /**
     * @return newest entry, or {@code null} when empty
     */
    public synchronized T latest() {
        return entries.peekLast();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
