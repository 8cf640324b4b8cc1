package com.driftguard.core.drift;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity FIFO buffer. Adding to a full buffer evicts the oldest
 * element.
 *
 * <p>
 * Not thread-safe.
 * </p>
 *
 * @param <T> element type
 * @since 1.0.0
 */
public final class RingBuffer<T> {

    private final int capacity;
    private final ArrayDeque<T> items;

    public RingBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * @param item element to append, must not be {@code null}
     * @return the evicted element, or {@code null} if the buffer was not full
     */
    public T add(T item) {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        T evicted = items.size() == capacity ? items.pollFirst() : null;
        items.addLast(item);
        return evicted;
    }

    /**
     * @return the elements from oldest to newest
     */
    public List<T> toList() {
        return new ArrayList<>(items);
    }

    public int size() {
        return items.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean isFull() {
        return items.size() == capacity;
    }
}
