package org.lite.dispatch.service.metrics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded FIFO of pending writes. When full, the oldest entries are dropped and counted;
 * {@link #offer} never blocks and never fails.
 */
public class MetricWriteBuffer<T> {

    private final int capacity;
    private final ArrayDeque<T> queue;
    private final AtomicLong dropped = new AtomicLong();

    public MetricWriteBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Appends an entry, returning the buffered size after the append.
     */
    public synchronized int offer(T item) {
        if (queue.size() >= capacity) {
            queue.pollFirst();
            dropped.incrementAndGet();
        }
        queue.addLast(item);
        return queue.size();
    }

    public synchronized List<T> drain(int maxItems) {
        int n = Math.min(maxItems, queue.size());
        List<T> batch = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            batch.add(queue.pollFirst());
        }
        return batch;
    }

    /**
     * Puts a failed batch back at the head in its original order. Entries that no longer fit are
     * dropped from the head, since they are the oldest.
     */
    public synchronized void requeue(List<T> batch) {
        for (int i = batch.size() - 1; i >= 0; i--) {
            queue.addFirst(batch.get(i));
        }
        while (queue.size() > capacity) {
            queue.pollFirst();
            dropped.incrementAndGet();
        }
    }

    public synchronized int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public long droppedCount() {
        return dropped.get();
    }
}
